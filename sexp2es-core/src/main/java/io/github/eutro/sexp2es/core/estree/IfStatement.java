package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

public final class IfStatement extends Statement {
    public final Expression test;
    public final Statement consequent;
    @Nullable
    public final Statement alternate;

    public IfStatement(Expression test, Statement consequent, @Nullable Statement alternate) {
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override
    public String type() {
        return "IfStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
