package io.github.eutro.qtx2qasm.core.ext;

import io.github.eutro.qtx2qasm.core.ssa.*;
import io.github.eutro.qtx2qasm.core.ssa.Module;

import java.util.List;

/**
 * Exts describing the structure of the IR, maintained by the IR classes themselves
 * or by {@link io.github.eutro.qtx2qasm.core.passes.meta metadata passes}.
 */
public class CommonExts {
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    public static final Ext<List<Insn>> USED_AT = Ext.create(List.class, "USED_AT");

    /**
     * A value known ahead of time for a variable. Attached by whoever folded it,
     * {@code null} constants are stored as {@link #CONSTANT_NULL_SENTINEL}.
     */
    public static final Ext<Object> CONSTANT_VALUE = Ext.create(Object.class, "CONSTANT_VALUE");
    public static final Object CONSTANT_NULL_SENTINEL = new Object();

    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");
    public static final Ext<Circuit> OWNING_CIRCUIT = Ext.create(Circuit.class, "OWNING_CIRCUIT");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");

    public static Object fillNull(Object obj) {
        return obj == null ? CONSTANT_NULL_SENTINEL : obj;
    }

    public static Object takeNull(Object obj) {
        return obj == CONSTANT_NULL_SENTINEL ? null : obj;
    }
}
