package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.ModuleCompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when OpenQASM source should be emitted.
 *
 * @see ModuleCompilation
 */
public class EmitQasmEvent implements ModuleCompileEvent, CancellableEvent {
    /**
     * The name to emit the source under.
     */
    @NotNull
    public String name;
    /**
     * The OpenQASM source.
     */
    @NotNull
    public String source;
    private boolean cancelled = false;

    public EmitQasmEvent(@NotNull String name, @NotNull String source) {
        this.name = name;
        this.source = source;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
