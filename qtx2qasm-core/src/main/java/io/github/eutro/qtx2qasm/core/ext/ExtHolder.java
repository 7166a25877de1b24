package io.github.eutro.qtx2qasm.core.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An implementation of {@link ExtContainer} backed by a lazily allocated map.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null; // most IR nodes never get any exts

    @NotNull
    private Map<Ext<?>, Object> getMap() {
        if (map == null) {
            map = new IdentityHashMap<>(4);
        }
        return map;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        getMap().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        map.remove(ext);
        if (map.isEmpty()) {
            map = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) map.get(ext);
    }
}
