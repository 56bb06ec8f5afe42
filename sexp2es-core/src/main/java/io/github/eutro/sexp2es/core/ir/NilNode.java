package io.github.eutro.sexp2es.core.ir;

public final class NilNode extends Node {
    @Override
    public String kind() {
        return "nil";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNil(this);
    }
}
