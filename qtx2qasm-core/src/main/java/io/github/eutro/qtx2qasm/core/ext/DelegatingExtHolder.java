package io.github.eutro.qtx2qasm.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another
 * {@link ExtContainer} for exts it doesn't have itself.
 * <p>
 * This is how instructions see the exts of their operation, and operations the exts of their key.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to fall back to.
     *
     * @return The delegate, may be null.
     */
    protected abstract ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T local = super.getNullable(ext);
        if (local != null) return local;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
