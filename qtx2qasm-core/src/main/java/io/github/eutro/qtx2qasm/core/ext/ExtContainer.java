package io.github.eutro.qtx2qasm.core.ext;

import io.github.eutro.qtx2qasm.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * A container for {@link Ext}s. See the {@link io.github.eutro.qtx2qasm.core.ext package-level documentation}.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext}, if any, from this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, or null if there is none.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value of {@code ext} in this container, throwing if there is none.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is not present.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value != null) return value;
        throw new IllegalStateException("ext " + ext.getName() + " not present on " + this);
    }

    /**
     * Get the value of {@code ext} in this container, or run a pass that computes it and try again.
     *
     * @param ext  The ext.
     * @param o    The IR to run the pass on.
     * @param pass The pass.
     * @param <T>  The type of the ext.
     * @param <O>  The type the pass operates on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
