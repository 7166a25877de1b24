/**
 * The ext API associates arbitrary data with
 * instances of {@link io.github.eutro.qtx2qasm.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * Var q = circuit.newVar("q", QType.WIRE); // attaches QtxExts.TYPE
 * q.getExtOrThrow(QtxExts.TYPE);           // => wire
 *
 * QtxOps.X.attachExt(QtxExts.OPERATOR_INTERFACE, true);
 * insn.getNullable(QtxExts.OPERATOR_INTERFACE); // instructions see the exts of their operation's key
 * }</pre>
 * <p>
 * Passes use exts as scratch data on IR nodes ({@link io.github.eutro.qtx2qasm.core.ext.CommonExts#USED_AT}),
 * and the IR uses them to carry attributes that not every node has
 * ({@link io.github.eutro.qtx2qasm.core.ext.QtxExts#ENTRY_POINT}).
 * <p>
 * Some IR classes store hot exts directly in fields, overriding the container methods.
 */
package io.github.eutro.qtx2qasm.core.ext;
