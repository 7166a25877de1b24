package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.Ext;
import io.github.eutro.qtx2qasm.core.ext.ExtHolder;
import io.github.eutro.qtx2qasm.core.ext.QtxExts;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A value in the IR: a wire, an array of wires, or a classical value.
 * <p>
 * Each variable is assigned exactly once, by an {@link Effect}, or is a formal
 * parameter or target of its {@link Circuit}.
 * Variables compare by identity; the name is only for display.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * Distinguishes variables of the same name within a circuit.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return '%' + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Effect assignedAt = null;
    private List<Insn> usedAt = null;
    private QType type = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        if (ext == CommonExts.USED_AT) {
            return (T) usedAt;
        }
        if (ext == QtxExts.TYPE) {
            return (T) type;
        }
        return super.getNullable(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        }
        if (ext == CommonExts.USED_AT) {
            usedAt = (List<Insn>) value;
            return;
        }
        if (ext == QtxExts.TYPE) {
            type = (QType) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        if (ext == CommonExts.USED_AT) {
            usedAt = null;
            return;
        }
        if (ext == QtxExts.TYPE) {
            type = null;
            return;
        }
        super.removeExt(ext);
    }
}
