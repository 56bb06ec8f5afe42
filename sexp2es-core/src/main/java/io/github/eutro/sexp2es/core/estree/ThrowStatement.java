package io.github.eutro.sexp2es.core.estree;

public final class ThrowStatement extends Statement {
    public final Expression argument;

    public ThrowStatement(Expression argument) {
        this.argument = argument;
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitThrowStatement(this);
    }
}
