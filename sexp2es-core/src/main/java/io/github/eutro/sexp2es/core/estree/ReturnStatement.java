package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

public final class ReturnStatement extends Statement {
    @Nullable
    public final Expression argument;

    public ReturnStatement(@Nullable Expression argument) {
        this.argument = argument;
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
