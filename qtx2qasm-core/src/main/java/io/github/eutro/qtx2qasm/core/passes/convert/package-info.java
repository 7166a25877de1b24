/**
 * Passes that convert the IR into another form.
 * <p>
 * {@link io.github.eutro.qtx2qasm.core.passes.convert.QtxToQasm} produces OpenQASM 2.0 source text.
 */
package io.github.eutro.qtx2qasm.core.passes.convert;
