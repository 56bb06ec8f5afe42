package io.github.eutro.sexp2es.core.estree;

import java.util.List;

public final class SwitchStatement extends Statement {
    public final Expression discriminant;
    public final List<SwitchCase> cases;

    public SwitchStatement(Expression discriminant, List<SwitchCase> cases) {
        this.discriminant = discriminant;
        this.cases = cases;
    }

    @Override
    public String type() {
        return "SwitchStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitSwitchStatement(this);
    }
}
