package io.github.eutro.sexp2es.core.estree;

import java.util.List;

public final class SequenceExpression extends Expression {
    public final List<Expression> expressions;

    public SequenceExpression(List<Expression> expressions) {
        this.expressions = expressions;
    }

    @Override
    public String type() {
        return "SequenceExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitSequenceExpression(this);
    }
}
