package io.github.eutro.sexp2es.core.ir;

import java.util.List;

public final class VectorNode extends Node {
    public final List<Node> items;

    public VectorNode(List<Node> items) {
        this.items = items;
    }

    @Override
    public String kind() {
        return "vector";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVector(this);
    }
}
