package io.github.eutro.sexp2es.core.ir;

public final class ThrowNode extends Node {
    public final Node value;

    public ThrowNode(Node value) {
        this.value = value;
    }

    @Override
    public String kind() {
        return "throw";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThrow(this);
    }
}
