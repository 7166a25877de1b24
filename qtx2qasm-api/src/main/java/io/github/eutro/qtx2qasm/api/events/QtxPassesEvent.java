package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.ModuleCompilation;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import org.jetbrains.annotations.NotNull;

/**
 * Fired before the module is translated, so listeners can run their own passes on it,
 * or replace it.
 *
 * @see ModuleCompilation
 */
public class QtxPassesEvent implements ModuleCompileEvent {
    /**
     * The QTX module.
     */
    @NotNull
    public Module qtx;

    /**
     * Whether the module should be checked for linear use of quantum values before translation.
     */
    public boolean verify = true;

    public QtxPassesEvent(@NotNull Module qtx) {
        this.qtx = qtx;
    }
}
