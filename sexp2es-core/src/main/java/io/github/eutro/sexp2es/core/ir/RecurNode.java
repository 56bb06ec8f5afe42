package io.github.eutro.sexp2es.core.ir;

import java.util.List;

public final class RecurNode extends Node {
    public final List<Node> params;

    public RecurNode(List<Node> params) {
        this.params = params;
    }

    @Override
    public String kind() {
        return "recur";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRecur(this);
    }
}
