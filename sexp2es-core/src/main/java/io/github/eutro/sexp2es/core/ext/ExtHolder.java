package io.github.eutro.sexp2es.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An {@link ExtContainer} backed by a map that is only allocated on the first attachment.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> exts;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) exts = new TreeMap<>();
        exts.put(ext, value);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }
}
