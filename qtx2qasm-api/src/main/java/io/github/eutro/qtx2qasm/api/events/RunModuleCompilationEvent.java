package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.ModuleCompilation;
import io.github.eutro.qtx2qasm.api.QasmCompiler;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a module compilation is started.
 *
 * @see QasmCompiler
 * @see ModuleCompilation
 */
public class RunModuleCompilationEvent implements CompilerEvent {
    /**
     * The module compilation.
     */
    @NotNull
    public ModuleCompilation compilation;

    public RunModuleCompilationEvent(@NotNull ModuleCompilation compilation) {
        this.compilation = compilation;
    }
}
