package io.github.eutro.sexp2es.core.ir;

import java.util.List;

/**
 * A function application.
 */
public final class InvokeNode extends Node {
    public final Node callee;
    public final List<Node> params;

    public InvokeNode(Node callee, List<Node> params) {
        this.callee = callee;
        this.params = params;
    }

    @Override
    public String kind() {
        return "invoke";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInvoke(this);
    }
}
