/**
 * The QTX intermediate representation.
 * <p>
 * A {@link io.github.eutro.qtx2qasm.core.ssa.Module} holds
 * {@link io.github.eutro.qtx2qasm.core.ssa.Circuit circuits}, each with a single
 * {@link io.github.eutro.qtx2qasm.core.ssa.BasicBlock body}. The body is a list of
 * {@link io.github.eutro.qtx2qasm.core.ssa.Effect effects} in program order, and a
 * {@link io.github.eutro.qtx2qasm.core.ssa.Control return} at the end.
 * <p>
 * Every {@link io.github.eutro.qtx2qasm.core.ssa.Var variable} is assigned once.
 * Quantum values are additionally linear: once a wire or array is passed to an operation,
 * it is dead, and the operation's results stand in for it. For example:
 *
 * <pre>
 * circuit @main() entrypoint {
 *   %q = qtx.alloca wire
 *   %q.1 = qtx.h params=0 controls=0 targets=1 %q
 *   %v, %q.2 = qtx.mz i1 %q.1
 *   qtx.dealloc %q.2
 *   func.return
 * }
 * </pre>
 *
 * {@link io.github.eutro.qtx2qasm.core.ssa.IRBuilder} is the usual way to construct this.
 */
package io.github.eutro.qtx2qasm.core.ssa;
