package io.github.eutro.liveopt.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that {@link Ext}s can be attached to.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, or null if it is absent.
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
     * Get the value of {@code ext} in this container, throwing if it is absent.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is absent.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Ext not present: " + ext.getName() + " on " + this);
    }
}
