package io.github.eutro.sexp2es.core.estree;

public final class MemberExpression extends Expression {
    public final Expression object;
    public final Expression property;
    public final boolean computed;

    public MemberExpression(Expression object, Expression property, boolean computed) {
        this.object = object;
        this.property = property;
        this.computed = computed;
    }

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitMemberExpression(this);
    }
}
