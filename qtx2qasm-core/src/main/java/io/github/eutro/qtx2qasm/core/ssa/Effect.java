package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.DelegatingExtHolder;
import io.github.eutro.qtx2qasm.core.ext.Ext;
import io.github.eutro.qtx2qasm.core.ext.ExtContainer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * variables its results are assigned to.
 * <p>
 * Constructing an effect marks each assigned variable as {@link CommonExts#ASSIGNED_AT assigned} here.
 */
public final class Effect extends DelegatingExtHolder {
    private final List<Var> assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = Collections.unmodifiableList(new ArrayList<>(assignsTo));
        for (Var var : this.assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    /**
     * Get the variables this effect assigns to, in result order.
     *
     * @return The variables.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    /**
     * Get the underlying instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the underlying instruction.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    @Override
    public String toString() {
        if (assignsTo.isEmpty()) {
            return insn.toString();
        }
        return assignsTo.stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", ", "", " = ")) + insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
