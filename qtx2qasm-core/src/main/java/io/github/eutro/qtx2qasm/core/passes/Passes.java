package io.github.eutro.qtx2qasm.core.passes;

import io.github.eutro.qtx2qasm.core.passes.meta.CheckLinearity;
import io.github.eutro.qtx2qasm.core.passes.misc.ForPass;
import io.github.eutro.qtx2qasm.core.ssa.Module;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Checks to run on a module before handing it to a backend.
     */
    public static final IRPass<Module, Module> VERIFY = ForPass.liftCircuits(CheckLinearity.INSTANCE);
}
