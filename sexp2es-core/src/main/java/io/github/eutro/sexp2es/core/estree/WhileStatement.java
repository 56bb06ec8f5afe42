package io.github.eutro.sexp2es.core.estree;

public final class WhileStatement extends Statement {
    public final Expression test;
    public final Statement body;

    public WhileStatement(Expression test, Statement body) {
        this.test = test;
        this.body = body;
    }

    @Override
    public String type() {
        return "WhileStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }
}
