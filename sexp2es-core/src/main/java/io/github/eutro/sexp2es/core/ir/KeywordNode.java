package io.github.eutro.sexp2es.core.ir;

public final class KeywordNode extends Node {
    public final String name;

    public KeywordNode(String name) {
        this.name = name;
    }

    @Override
    public String kind() {
        return "keyword";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitKeyword(this);
    }
}
