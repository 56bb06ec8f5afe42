package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A literal value.
 */
public final class ConstantNode extends Node {
    /**
     * The value: a {@link Boolean}, {@link Number}, {@link String} or {@link RegExp}
     * according to {@link #type}, or null for {@link Type#NIL}.
     */
    @Nullable
    public final Object value;
    @NotNull
    public final Type type;

    public ConstantNode(@Nullable Object value, @NotNull Type type) {
        this.value = value;
        this.type = type;
    }

    @Override
    public String kind() {
        return "constant";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    public enum Type {
        NIL,
        BOOLEAN,
        NUMBER,
        STRING,
        REGEXP,
    }

    /**
     * A regular expression literal, kept in its source form.
     */
    public static final class RegExp {
        public final String pattern;
        public final String flags;

        public RegExp(String pattern, String flags) {
            this.pattern = pattern;
            this.flags = flags;
        }

        @Override
        public String toString() {
            return "/" + pattern + "/" + flags;
        }
    }
}
