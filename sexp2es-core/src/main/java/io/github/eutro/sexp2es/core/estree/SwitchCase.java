package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A {@code case} of a switch, or its {@code default} when {@link #test} is null.
 */
public final class SwitchCase extends EsNode {
    @Nullable
    public final Expression test;
    public final List<Statement> consequent;

    public SwitchCase(@Nullable Expression test, List<Statement> consequent) {
        this.test = test;
        this.consequent = consequent;
    }

    @Override
    public String type() {
        return "SwitchCase";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitSwitchCase(this);
    }
}
