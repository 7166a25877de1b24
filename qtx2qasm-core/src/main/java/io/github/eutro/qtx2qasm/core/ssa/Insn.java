package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.DelegatingExtHolder;
import io.github.eutro.qtx2qasm.core.ext.Ext;
import io.github.eutro.qtx2qasm.core.ext.ExtContainer;
import io.github.eutro.qtx2qasm.core.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An instruction: an {@link Op operation} applied to a list of argument variables.
 * <p>
 * An instruction becomes part of a {@link BasicBlock} by being wrapped in an {@link Effect},
 * which names its results, or a {@link Control}, which ends the block.
 */
public final class Insn extends DelegatingExtHolder {
    /**
     * Whether to record a stack trace where each instruction is constructed, for debugging.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("QTX2QASM_TRACK_INSN_CREATIONS") != null;

    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    public Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    /**
     * Get the arguments of this instruction. The list is mutable.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    /**
     * Create an effect assigning the results of this instruction to the given variables.
     *
     * @param vars The variables.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return assignTo(Arrays.asList(vars));
    }

    /**
     * Create an effect assigning the results of this instruction to the given variables.
     *
     * @param vars The variables.
     * @return The effect.
     */
    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    /**
     * Create a control instruction from this instruction, which terminates a block.
     *
     * @return The control instruction.
     */
    public Control terminates() {
        return new Control(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
