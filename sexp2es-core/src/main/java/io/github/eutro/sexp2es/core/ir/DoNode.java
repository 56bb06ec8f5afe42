package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A sequence of statements evaluated for effect, followed by an optional result.
 */
public final class DoNode extends Node {
    public final List<Node> statements;
    @Nullable
    public final Node result;

    public DoNode(List<Node> statements, @Nullable Node result) {
        this.statements = statements;
        this.result = result;
    }

    @Override
    public String kind() {
        return "do";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDo(this);
    }
}
