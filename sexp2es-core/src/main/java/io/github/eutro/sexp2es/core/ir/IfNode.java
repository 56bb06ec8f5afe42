package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

public final class IfNode extends Node {
    public final Node test;
    public final Node consequent;
    @Nullable
    public final Node alternate;

    public IfNode(Node test, Node consequent, @Nullable Node alternate) {
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override
    public String kind() {
        return "if";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
