package io.github.eutro.sexp2es.core;

import io.github.eutro.sexp2es.core.ir.Node;

/**
 * Thrown when a node has no lowering where it appears, such as a {@code recur}
 * that is not in the tail of a {@code loop}.
 */
public class UnsupportedNodeException extends CompileException {
    private final String kind;

    public UnsupportedNodeException(Node node) {
        super("Unsupported operation: " + node.kind(), node);
        this.kind = node.kind();
    }

    /**
     * Get the kind of node that was not supported.
     *
     * @return The kind, as in {@link Node#kind()}.
     */
    public String getKind() {
        return kind;
    }
}
