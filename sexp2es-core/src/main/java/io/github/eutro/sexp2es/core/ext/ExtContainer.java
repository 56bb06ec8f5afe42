package io.github.eutro.sexp2es.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something {@link Ext} values can be attached to. See the {@link io.github.eutro.sexp2es.core.ext package docs}.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} under {@code ext}, replacing any previous value.
     *
     * @param ext   The key.
     * @param value The value.
     * @param <T>   The type of the value.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Look up the value attached under {@code ext}.
     *
     * @param ext The key.
     * @param <T> The type of the value.
     * @return The value, or null if nothing is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);
}
