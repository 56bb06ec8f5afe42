package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

/**
 * A literal. {@link #value} is null, a {@link Boolean}, a {@link Number} or a {@link String};
 * a regular expression literal has a null value and a non-null {@link #regex}.
 */
public final class Literal extends Expression {
    @Nullable
    public final Object value;
    @Nullable
    public final Regex regex;

    public Literal(@Nullable Object value) {
        this(value, null);
    }

    public Literal(@Nullable Object value, @Nullable Regex regex) {
        this.value = value;
        this.regex = regex;
    }

    @Override
    public String type() {
        return "Literal";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    public static final class Regex {
        public final String pattern;
        public final String flags;

        public Regex(String pattern, String flags) {
            this.pattern = pattern;
            this.flags = flags;
        }
    }
}
