/**
 * Support for emitting OpenQASM 2.0: naming, text output and legality rules.
 * <p>
 * OpenQASM addresses qubits by register and index, so every quantum value of the
 * IR is given the symbol of the register slot it lives in, for example {@code q0[1]}.
 * When an operation consumes a wire and produces a new one, the new wire takes over the old one's
 * symbol, so a chain of SSA values maps onto one slot.
 */
package io.github.eutro.qtx2qasm.core.qasm;
