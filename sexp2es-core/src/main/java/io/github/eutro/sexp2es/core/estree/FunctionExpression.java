package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class FunctionExpression extends Expression {
    @Nullable
    public final Identifier id;
    public final List<Identifier> params;
    public final BlockStatement body;

    public FunctionExpression(@Nullable Identifier id, List<Identifier> params, BlockStatement body) {
        this.id = id;
        this.params = params;
        this.body = body;
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitFunctionExpression(this);
    }
}
