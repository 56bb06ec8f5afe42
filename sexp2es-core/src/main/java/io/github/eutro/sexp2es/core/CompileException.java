package io.github.eutro.sexp2es.core;

import io.github.eutro.sexp2es.core.ext.CommonExts;
import io.github.eutro.sexp2es.core.ir.Location;
import io.github.eutro.sexp2es.core.ir.Node;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a program cannot be lowered.
 * <p>
 * Lowering is fail-fast: the first error aborts the whole program, and no partial output is produced.
 */
public class CompileException extends RuntimeException {
    @Nullable
    private final Location location;

    public CompileException(String message, @Nullable Location location) {
        super(location == null ? message : location.startLine + ":" + location.startColumn + ": " + message);
        this.location = location;
    }

    /**
     * Construct an exception about {@code node}, taking its location and original form if it has them.
     *
     * @param message The message.
     * @param node    The node that could not be lowered, or null.
     */
    public CompileException(String message, @Nullable Node node) {
        this(describe(message, node), node == null ? null : node.getLocation());
    }

    private static String describe(String message, @Nullable Node node) {
        if (node == null) return message;
        String form = node.getNullable(CommonExts.ORIGINAL_FORM);
        return form == null ? message : message + " in " + form;
    }

    /**
     * Get where in the source the error is, if known.
     *
     * @return The location, or null.
     */
    @Nullable
    public Location getLocation() {
        return location;
    }
}
