package io.github.eutro.sexp2es.core.estree;

import java.util.List;

public final class ObjectExpression extends Expression {
    public final List<Property> properties;

    public ObjectExpression(List<Property> properties) {
        this.properties = properties;
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitObjectExpression(this);
    }
}
