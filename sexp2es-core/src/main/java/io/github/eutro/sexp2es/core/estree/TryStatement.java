package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

public final class TryStatement extends Statement {
    public final BlockStatement block;
    @Nullable
    public final CatchClause handler;
    @Nullable
    public final BlockStatement finalizer;

    public TryStatement(BlockStatement block, @Nullable CatchClause handler, @Nullable BlockStatement finalizer) {
        this.block = block;
        this.handler = handler;
        this.finalizer = finalizer;
    }

    @Override
    public String type() {
        return "TryStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitTryStatement(this);
    }
}
