package io.github.eutro.qtx2qasm.api.bits;

import io.github.eutro.qtx2qasm.api.QasmCompiler;

/**
 * A bundle of listeners that can be installed on a {@link QasmCompiler}
 * or on anything else events are dispatched from, such as
 * {@link OutputsToDirectory}, which saves every emitted program to disk.
 *
 * @param <Onto> The type this installs onto.
 * @param <Ret>  The result of installing it.
 * @see QasmCompiler#add(Bit)
 */
@FunctionalInterface
public interface Bit<Onto, Ret> {
    /**
     * Install this bit.
     *
     * @param target Where to register its listeners.
     * @return Whatever the bit hands back, often nothing.
     */
    Ret addTo(Onto target);
}
