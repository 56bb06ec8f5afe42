package io.github.eutro.sexp2es.core.estree;

/**
 * A prefix unary operation. Only prefix operators are produced.
 */
public final class UnaryExpression extends Expression {
    public final String operator;
    public final Expression argument;
    public final boolean prefix = true;

    public UnaryExpression(String operator, Expression argument) {
        this.operator = operator;
        this.argument = argument;
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitUnaryExpression(this);
    }
}
