package io.github.eutro.qtx2qasm.api;

import io.github.eutro.qtx2qasm.api.events.*;
import io.github.eutro.qtx2qasm.core.passes.IRPass;
import io.github.eutro.qtx2qasm.core.passes.Passes;
import io.github.eutro.qtx2qasm.core.passes.convert.QtxToQasm;
import io.github.eutro.qtx2qasm.core.qasm.QasmConventions;
import io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Represents the compilation of a single QTX module.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunModuleCompilationEvent} is fired on the {@link QasmCompiler compiler}.</li>
 *     <li>{@link ModifyConventionsEvent} is fired.</li>
 *     <li>{@link QtxPassesEvent} is fired, and then the module is {@link Passes#VERIFY verified}
 *     unless a listener turned that off.</li>
 *     <li>The module is {@link QtxToQasm translated to OpenQASM}.</li>
 *     <li>{@link EmitQasmEvent} is fired with the source.</li>
 * </ol>
 * If the module cannot be expressed in OpenQASM 2.0, {@link CompilationFailedEvent} is fired
 * instead of {@link EmitQasmEvent}, so nothing is output for this module.
 */
public class ModuleCompilation extends EventSupplier<ModuleCompileEvent> {
    private static final Logger LOGGER = LogManager.getLogger();

    private final QasmCompiler cc;

    /**
     * The module being compiled.
     */
    @NotNull
    public Module module;
    private String name;

    ModuleCompilation(QasmCompiler cc, @NotNull Module module) {
        this.cc = cc;
        this.module = module;
        this.name = module.name;
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return Whether OpenQASM was emitted.
     */
    public boolean run() {
        cc.dispatch(RunModuleCompilationEvent.class, new RunModuleCompilationEvent(this));
        QasmConventions conventions = dispatch(ModifyConventionsEvent.class,
                new ModifyConventionsEvent(QasmConventions.builder()))
                .conventionBuilder
                .build();

        QtxPassesEvent passesEvent = dispatch(QtxPassesEvent.class, new QtxPassesEvent(module));
        IRPass<Module, String> translate = new QtxToQasm(conventions);
        if (passesEvent.verify) {
            translate = Passes.VERIFY.then(translate);
        }

        String source;
        try {
            source = translate.run(passesEvent.qtx);
        } catch (QasmTranslationException e) {
            LOGGER.error("cannot compile module {} to OpenQASM 2.0: {}", name, e.getMessage());
            dispatch(CompilationFailedEvent.class, new CompilationFailedEvent(name, e));
            return false;
        }
        LOGGER.info("compiled module {} to OpenQASM 2.0", name);
        dispatch(EmitQasmEvent.class, new EmitQasmEvent(name, source));
        return true;
    }

    /**
     * Get the name outputs of this compilation are emitted under.
     *
     * @return The name, by default the name of the module.
     */
    public String getName() {
        return name;
    }

    /**
     * Set the name outputs of this compilation are emitted under.
     *
     * @param name The name.
     * @return This, for convenience.
     */
    public ModuleCompilation setName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Set the compiler name written in the header of the output, by
     * {@link ModifyConventionsEvent modifying the conventions}.
     *
     * @param compilerName The compiler name.
     * @return This, for convenience.
     * @see QasmConventions.Builder#setCompilerName(String)
     */
    public ModuleCompilation setCompilerName(String compilerName) {
        listen(ModifyConventionsEvent.class, mce -> mce.conventionBuilder.setCompilerName(compilerName));
        return this;
    }
}
