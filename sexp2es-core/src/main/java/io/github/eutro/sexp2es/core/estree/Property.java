package io.github.eutro.sexp2es.core.estree;

/**
 * An {@code init} property of an {@link ObjectExpression}.
 */
public final class Property extends EsNode {
    public final Expression key;
    public final Expression value;
    public final boolean computed;
    public final String kind = "init";

    public Property(Expression key, Expression value, boolean computed) {
        this.key = key;
        this.value = value;
        this.computed = computed;
    }

    @Override
    public String type() {
        return "Property";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }
}
