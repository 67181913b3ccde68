package io.github.eutro.liveopt.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An implementation of {@link ExtContainer}.
 * <p>
 * The first ext attached is kept in a field. Further exts go in a {@link TreeMap},
 * which is only allocated once there are two.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Ext<?> firstExt;
    @Nullable
    private Object firstValue;
    @Nullable
    private TreeMap<Ext<?>, Object> rest;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (firstExt == null || firstExt == ext) {
            firstExt = ext;
            firstValue = value;
            return;
        }
        if (rest == null) {
            rest = new TreeMap<>();
        }
        rest.put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (firstExt == ext) {
            firstExt = null;
            firstValue = null;
            if (rest != null) {
                Map.Entry<Ext<?>, Object> promoted = rest.pollFirstEntry();
                firstExt = promoted.getKey();
                firstValue = promoted.getValue();
                if (rest.isEmpty()) rest = null;
            }
            return;
        }
        if (rest == null) return;
        rest.remove(ext);
        if (rest.isEmpty()) {
            rest = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (firstExt == ext) return (T) firstValue;
        if (rest == null) return null;
        return (T) rest.get(ext);
    }
}
