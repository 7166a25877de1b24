package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.ModuleCompilation;
import io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a module cannot be translated. No {@link EmitQasmEvent} follows.
 *
 * @see ModuleCompilation
 */
public class CompilationFailedEvent implements ModuleCompileEvent {
    @NotNull
    public final String name;
    /**
     * Why the translation failed.
     */
    @NotNull
    public final QasmTranslationException cause;

    public CompilationFailedEvent(@NotNull String name, @NotNull QasmTranslationException cause) {
        this.name = name;
        this.cause = cause;
    }
}
