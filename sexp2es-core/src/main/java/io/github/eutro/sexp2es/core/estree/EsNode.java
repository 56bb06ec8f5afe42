package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

/**
 * A node of an <a href="https://github.com/estree/estree">ESTree</a> syntax tree.
 * <p>
 * These are plain data: the lowering constructs them, and the printer reads them.
 * Nothing in this project interprets an ESTree once it is built.
 */
public abstract class EsNode {
    /**
     * The source span this node was lowered from, if known.
     */
    @Nullable
    public SourceLocation loc;

    /**
     * Get the ESTree {@code type} of this node, such as {@code "CallExpression"}.
     *
     * @return The type name.
     */
    public abstract String type();

    /**
     * Call the method of {@code visitor} that corresponds to the type of this node.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return What the visitor returned.
     */
    public abstract <R> R accept(EsVisitor<R> visitor);

    @Override
    public String toString() {
        return type();
    }
}
