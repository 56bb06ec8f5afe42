package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class LetNode extends Node {
    public final List<Binding> bindings;
    public final List<Node> statements;
    @Nullable
    public final Node result;

    public LetNode(List<Binding> bindings, List<Node> statements, @Nullable Node result) {
        this.bindings = bindings;
        this.statements = statements;
        this.result = result;
    }

    @Override
    public String kind() {
        return "let";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLet(this);
    }
}
