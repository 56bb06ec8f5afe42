package io.github.eutro.sexp2es.core.estree;

import java.util.List;

public final class CallExpression extends Expression {
    public final Expression callee;
    public final List<Expression> arguments;

    public CallExpression(Expression callee, List<Expression> arguments) {
        this.callee = callee;
        this.arguments = arguments;
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitCallExpression(this);
    }
}
