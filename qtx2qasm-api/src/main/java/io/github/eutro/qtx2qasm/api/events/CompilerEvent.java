package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.QasmCompiler;

/**
 * An event fired on a {@link QasmCompiler}.
 */
public interface CompilerEvent {
}
