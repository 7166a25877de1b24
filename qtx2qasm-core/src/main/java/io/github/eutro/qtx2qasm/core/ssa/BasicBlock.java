package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.Ext;
import io.github.eutro.qtx2qasm.core.ext.ExtContainer;
import io.github.eutro.qtx2qasm.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A straight-line sequence of {@link Effect effects} in program order,
 * followed by exactly one {@link Control} instruction at the end.
 */
public final class BasicBlock extends ExtHolder {
    private final List<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    BasicBlock() {
    }

    /**
     * Get the effects of this block, in program order. The list is mutable.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    /**
     * Append an effect to this block.
     *
     * @param effect The effect.
     */
    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the terminator of this block, or null if it has not been set yet.
     *
     * @return The terminator.
     */
    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        this.control = registerWithThis(control);
    }

    private <T extends ExtContainer> T registerWithThis(T extable) {
        if (extable != null) {
            extable.attachExt(CommonExts.OWNING_BLOCK, this);
        }
        return extable;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{\n");
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        sb.append("  ").append(control).append("\n}");
        return sb.toString();
    }

    // exts
    private Circuit owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_CIRCUIT) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_CIRCUIT) {
            owner = (Circuit) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_CIRCUIT) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
