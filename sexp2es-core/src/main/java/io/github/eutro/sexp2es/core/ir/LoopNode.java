package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A tail-recursive loop. A {@link RecurNode} in tail position of {@link #result}
 * re-enters the loop with new values for {@link #bindings}.
 */
public final class LoopNode extends Node {
    public final List<Binding> bindings;
    public final List<Node> statements;
    @Nullable
    public final Node result;

    public LoopNode(List<Binding> bindings, List<Node> statements, @Nullable Node result) {
        this.bindings = bindings;
        this.statements = statements;
        this.result = result;
    }

    @Override
    public String kind() {
        return "loop";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
