package io.github.eutro.qtx2qasm.core.ssa;

import java.util.*;

/**
 * A list view which is notified of every element that enters or leaves it.
 * The IR uses this to keep ownership exts in sync with its containers.
 *
 * @param <E> The element type.
 */
abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }
}
