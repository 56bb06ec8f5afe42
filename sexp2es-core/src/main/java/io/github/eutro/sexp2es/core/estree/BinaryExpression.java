package io.github.eutro.sexp2es.core.estree;

public final class BinaryExpression extends Expression {
    public final String operator;
    public final Expression left;
    public final Expression right;

    public BinaryExpression(String operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }
}
