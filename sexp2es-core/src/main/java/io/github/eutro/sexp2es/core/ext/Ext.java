package io.github.eutro.sexp2es.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for side-data on an {@link ExtContainer}, such as the source location of an IR node.
 * <p>
 * Keys compare by creation order and are only equal to themselves.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.getAndIncrement();
    private final Class<? super T> valueClass;
    private final String name;

    private Ext(Class<? super T> valueClass, String name) {
        this.valueClass = valueClass;
        this.name = name;
    }

    /**
     * Create a key.
     *
     * @param valueClass The class of values, for {@link #toString()} only.
     * @param name       A name for diagnostics.
     * @param <T>        The type of the attached value.
     * @return The key.
     */
    public static <T> Ext<T> create(Class<? super T> valueClass, String name) {
        return new Ext<>(valueClass, name);
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
        return name + " (" + valueClass.getSimpleName() + ")";
    }
}
