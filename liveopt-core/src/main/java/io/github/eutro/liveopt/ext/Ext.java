package io.github.eutro.liveopt.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value can be attached to an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which is what {@link ExtHolder} sorts by.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext.
     * <p>
     * {@code R} may be a parameterised subtype of {@code T}, e.g. an
     * {@code Ext<List<BasicBlock>>} is created from {@code List.class}.
     *
     * @param type The most specific class of the attached values.
     * @param name The name of the ext, for debugging.
     * @param <T>  The class type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the class this ext was created with.
     *
     * @return The class.
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
