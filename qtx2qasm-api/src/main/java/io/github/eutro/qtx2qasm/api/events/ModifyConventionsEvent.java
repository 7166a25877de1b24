package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.ModuleCompilation;
import io.github.eutro.qtx2qasm.core.qasm.QasmConventions;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when constructing the {@link QasmConventions conventions} of a
 * module compilation.
 *
 * @see ModuleCompilation
 * @see QasmConventions.Builder
 */
public class ModifyConventionsEvent implements ModuleCompileEvent {
    /**
     * The convention builder.
     */
    @NotNull
    public QasmConventions.Builder conventionBuilder;

    public ModifyConventionsEvent(@NotNull QasmConventions.Builder conventionBuilder) {
        this.conventionBuilder = conventionBuilder;
    }
}
