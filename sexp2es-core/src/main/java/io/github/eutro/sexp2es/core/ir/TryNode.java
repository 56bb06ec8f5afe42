package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

public final class TryNode extends Node {
    public final Node body;
    @Nullable
    public final Handler handler;
    @Nullable
    public final Node finalizer;

    public TryNode(Node body, @Nullable Handler handler, @Nullable Node finalizer) {
        this.body = body;
        this.handler = handler;
        this.finalizer = finalizer;
    }

    @Override
    public String kind() {
        return "try";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTry(this);
    }

    /**
     * A catch clause, binding the caught value to {@link #name} while {@link #body} runs.
     */
    public static final class Handler {
        public final String name;
        public final Node body;

        public Handler(String name, Node body) {
            this.name = name;
            this.body = body;
        }
    }
}
