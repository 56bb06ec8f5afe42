package io.github.eutro.sexp2es.core.estree;

/**
 * A short-circuiting {@code &&} or {@code ||}.
 */
public final class LogicalExpression extends Expression {
    public final String operator;
    public final Expression left;
    public final Expression right;

    public LogicalExpression(String operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public String type() {
        return "LogicalExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitLogicalExpression(this);
    }
}
