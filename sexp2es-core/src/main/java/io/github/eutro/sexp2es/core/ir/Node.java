package io.github.eutro.sexp2es.core.ir;

import io.github.eutro.sexp2es.core.ext.CommonExts;
import io.github.eutro.sexp2es.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * A node of the analyzed intermediate representation.
 * <p>
 * The set of node kinds is closed: every subclass lives in this package,
 * and each one has a corresponding method on {@link NodeVisitor}, so a visitor
 * that compiles handles every kind of node.
 * <p>
 * Nodes are produced by the analyzer and are treated as immutable by
 * everything in this project. Source locations and any other metadata are
 * attached as {@link io.github.eutro.sexp2es.core.ext.Ext exts}.
 */
public abstract class Node extends ExtHolder {
    Node() {
    }

    /**
     * Get the name of the operation this node represents, such as {@code "invoke"} or {@code "set!"}.
     *
     * @return The kind of the node.
     */
    public abstract String kind();

    /**
     * Call the method of {@code visitor} that corresponds to the kind of this node.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return What the visitor returned.
     */
    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Get the source location of this node, if the analyzer recorded one.
     *
     * @return The location, or null.
     */
    @Nullable
    public Location getLocation() {
        return getNullable(CommonExts.LOCATION);
    }

    @Override
    public String toString() {
        Location loc = getLocation();
        return loc == null ? kind() : kind() + "@" + loc;
    }
}
