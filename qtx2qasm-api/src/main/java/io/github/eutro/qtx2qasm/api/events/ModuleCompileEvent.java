package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.ModuleCompilation;
import io.github.eutro.qtx2qasm.api.QasmCompiler;

/**
 * Marker for the events a single {@link ModuleCompilation} fires, from
 * {@link ModifyConventionsEvent} through to either {@link EmitQasmEvent}
 * or {@link CompilationFailedEvent}.
 * <p>
 * Listen to these on every compilation at once with {@link QasmCompiler#lift()}.
 */
public interface ModuleCompileEvent {
}
