package io.github.eutro.qtx2qasm.core.ext;

import io.github.eutro.qtx2qasm.core.ssa.QType;

/**
 * Exts specific to quantum (QTX) IR.
 */
public class QtxExts {
    /**
     * The type of a {@link io.github.eutro.qtx2qasm.core.ssa.Var variable}.
     */
    public static final Ext<QType> TYPE = Ext.create(QType.class, "TYPE");

    /**
     * Marks the one {@link io.github.eutro.qtx2qasm.core.ssa.Circuit circuit} of a module
     * that is the program itself, rather than a reusable gate.
     */
    public static final Ext<Boolean> ENTRY_POINT = Ext.create(Boolean.class, "ENTRY_POINT");

    /**
     * Marks operation keys that are quantum operators (gates), whose payload
     * is an {@link io.github.eutro.qtx2qasm.core.ops.QtxOps.OperatorType}.
     */
    public static final Ext<Boolean> OPERATOR_INTERFACE = Ext.create(Boolean.class, "OPERATOR_INTERFACE");

    /**
     * Marks operation keys that are assumed to have no effect on the quantum program
     * at this level of abstraction, such as deallocation and constants.
     */
    public static final Ext<Boolean> NO_RUNTIME_EFFECT = Ext.create(Boolean.class, "NO_RUNTIME_EFFECT");

    public static <T extends ExtContainer> T mark(T t, Ext<Boolean> flag) {
        t.attachExt(flag, true);
        return t;
    }
}
