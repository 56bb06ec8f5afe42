package io.github.eutro.sexp2es.core.ir;

import java.util.List;

public final class NewNode extends Node {
    public final Node constructor;
    public final List<Node> params;

    public NewNode(Node constructor, List<Node> params) {
        this.constructor = constructor;
        this.params = params;
    }

    @Override
    public String kind() {
        return "new";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNew(this);
    }
}
