/**
 * A configurable API over the core qtx2qasm API.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.qtx2qasm.api.QasmCompiler},
 * to which QTX modules can be submitted for compilation.
 * <p>
 * The compiler can be configured using the {@link io.github.eutro.qtx2qasm.api.events
 * events API}.
 */
package io.github.eutro.qtx2qasm.api;
