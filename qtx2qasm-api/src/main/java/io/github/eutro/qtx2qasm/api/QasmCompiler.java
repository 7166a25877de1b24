package io.github.eutro.qtx2qasm.api;

import io.github.eutro.qtx2qasm.api.bits.Bit;
import io.github.eutro.qtx2qasm.api.events.*;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * The compiler, to which QTX modules can be submitted for translation to OpenQASM.
 * <p>
 * Listeners added here, or through {@link #lift()}, apply to every compilation this compiler starts.
 */
public class QasmCompiler extends EventSupplier<CompilerEvent> {
    /**
     * Submit a module for compilation. Nothing happens until {@link ModuleCompilation#run()} is called.
     *
     * @param module The module.
     * @return The compilation.
     */
    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    public ModuleCompilation submit(Module module) {
        ModuleCompilation compilation = new ModuleCompilation(this, module);
        dispatch(NewModuleCompilationEvent.class, new NewModuleCompilationEvent(compilation));
        return compilation;
    }

    /**
     * Get an event dispatcher on which listeners will be added to every module compilation
     * started by this compiler.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<ModuleCompileEvent> lift() {
        return new EventDispatcher<ModuleCompileEvent>() {
            @Override
            public <T extends ModuleCompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                QasmCompiler.this.listen(RunModuleCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect the source of every successfully compiled module, by module name.
     *
     * @return The live map of outputs.
     */
    public Map<String, String> outputsAsMap() {
        Map<String, String> outputs = new ConcurrentHashMap<>();
        lift().listen(EmitQasmEvent.class, evt -> outputs.put(evt.name, evt.source));
        return outputs;
    }

    public <T> T add(Bit<? super QasmCompiler, T> bit) {
        return bit.addTo(this);
    }
}
