package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.DelegatingExtHolder;
import io.github.eutro.qtx2qasm.core.ext.Ext;
import io.github.eutro.qtx2qasm.core.ext.ExtContainer;
import io.github.eutro.qtx2qasm.core.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * The instruction that ends a {@link BasicBlock}.
 * <p>
 * Circuits have no control flow, so the only terminator the backends know is {@link CommonOps#RETURN}.
 */
public final class Control extends DelegatingExtHolder {
    private Insn insn;

    Control(Insn insn) {
        setInsn(insn);
    }

    /**
     * Construct a return of the given values.
     *
     * @param values The returned values.
     * @return The control instruction.
     */
    public static Control ret(Var... values) {
        return CommonOps.RETURN.insn(Arrays.asList(values)).terminates();
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
        this.insn = insn;
    }

    @Override
    public String toString() {
        return insn.toString();
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
