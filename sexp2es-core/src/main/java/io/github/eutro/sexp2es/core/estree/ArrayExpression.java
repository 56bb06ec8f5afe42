package io.github.eutro.sexp2es.core.estree;

import java.util.List;

public final class ArrayExpression extends Expression {
    public final List<Expression> elements;

    public ArrayExpression(List<Expression> elements) {
        this.elements = elements;
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitArrayExpression(this);
    }
}
