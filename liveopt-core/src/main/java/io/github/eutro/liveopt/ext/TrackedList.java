package io.github.eutro.liveopt.ext;

import java.util.*;

/**
 * A list view which is notified of every element added to or removed from it.
 * <p>
 * {@link #onAdded(Object)} runs before the element is inserted, so it may reject the element
 * by throwing, leaving the list unchanged.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList(List<E> viewed) {
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
    public E set(int index, E element) {
        onAdded(element);
        E removed = viewed.set(index, element);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        for (E e : viewed) {
            onRemoved(e);
        }
        viewed.clear();
    }
}
