package io.github.eutro.sexp2es.core.ir;

/**
 * A reference to a binding, by its source name.
 */
public final class VarNode extends Node {
    public final String name;

    public VarNode(String name) {
        this.name = name;
    }

    @Override
    public String kind() {
        return "var";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVar(this);
    }
}
