package io.github.eutro.qtx2qasm.core.ext;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key, under which a value of type {@code T} can be stored
 * in an {@link ExtContainer}.
 * <p>
 * Exts compare by identity. Two exts with the same name and type are still distinct.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class is only used for display, so raw classes of generic types
     * (e.g. {@code List.class} for an {@code Ext<List<Insn>>}) are fine.
     *
     * @param type The most specific superclass of the type of the ext.
     * @param name The name of the ext.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the name this ext was created with.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the association of this in the given container.
     *
     * @param ec The container.
     * @return The association.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
