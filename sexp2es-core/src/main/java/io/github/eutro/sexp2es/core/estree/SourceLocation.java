package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An ESTree {@code SourceLocation}.
 */
public final class SourceLocation {
    @Nullable
    public final String source;
    public final Position start;
    public final Position end;

    public SourceLocation(@Nullable String source, Position start, Position end) {
        this.source = source;
        this.start = start;
        this.end = end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceLocation that = (SourceLocation) o;
        return Objects.equals(source, that.source) && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, start, end);
    }

    @Override
    public String toString() {
        return (source == null ? "" : source + ":") + start + "-" + end;
    }

    public static final class Position {
        public final int line;
        public final int column;

        public Position(int line, int column) {
            this.line = line;
            this.column = column;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Position position = (Position) o;
            return line == position.line && column == position.column;
        }

        @Override
        public int hashCode() {
            return Objects.hash(line, column);
        }

        @Override
        public String toString() {
            return line + ":" + column;
        }
    }
}
