package io.github.eutro.sexp2es.core.ir;

public final class SetNode extends Node {
    public final Node target;
    public final Node value;

    public SetNode(Node target, Node value) {
        this.target = target;
        this.value = value;
    }

    @Override
    public String kind() {
        return "set!";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSet(this);
    }
}
