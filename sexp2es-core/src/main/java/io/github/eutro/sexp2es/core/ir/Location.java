package io.github.eutro.sexp2es.core.ir;

import java.util.Objects;

/**
 * A span of source text, as recorded by the reader.
 * <p>
 * Lines are 1-based and columns are 0-based, matching the ESTree location convention.
 */
public final class Location {
    public final int startLine;
    public final int startColumn;
    public final int endLine;
    public final int endColumn;

    public Location(int startLine, int startColumn, int endLine, int endColumn) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Location location = (Location) o;
        return startLine == location.startLine
                && startColumn == location.startColumn
                && endLine == location.endLine
                && endColumn == location.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
