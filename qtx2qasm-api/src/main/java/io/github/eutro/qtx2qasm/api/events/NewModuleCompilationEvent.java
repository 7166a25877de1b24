package io.github.eutro.qtx2qasm.api.events;

import io.github.eutro.qtx2qasm.api.ModuleCompilation;
import io.github.eutro.qtx2qasm.api.QasmCompiler;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a module is {@link QasmCompiler#submit(io.github.eutro.qtx2qasm.core.ssa.Module) submitted},
 * before the compilation is run.
 */
public class NewModuleCompilationEvent implements CompilerEvent {
    @NotNull
    public ModuleCompilation compilation;

    public NewModuleCompilationEvent(@NotNull ModuleCompilation compilation) {
        this.compilation = compilation;
    }
}
