package io.github.eutro.sexp2es.core.estree;

public final class ExpressionStatement extends Statement {
    public final Expression expression;

    public ExpressionStatement(Expression expression) {
        this.expression = expression;
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
