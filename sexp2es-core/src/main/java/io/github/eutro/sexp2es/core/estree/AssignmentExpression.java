package io.github.eutro.sexp2es.core.estree;

public final class AssignmentExpression extends Expression {
    public final String operator;
    public final Expression left;
    public final Expression right;

    public AssignmentExpression(String operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitAssignmentExpression(this);
    }
}
