package io.github.eutro.sexp2es.core.estree;

public final class ConditionalExpression extends Expression {
    public final Expression test;
    public final Expression consequent;
    public final Expression alternate;

    public ConditionalExpression(Expression test, Expression consequent, Expression alternate) {
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override
    public String type() {
        return "ConditionalExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitConditionalExpression(this);
    }
}
