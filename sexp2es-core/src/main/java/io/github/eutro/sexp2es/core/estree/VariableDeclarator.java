package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Nullable;

public final class VariableDeclarator extends EsNode {
    public final Identifier id;
    @Nullable
    public final Expression init;

    public VariableDeclarator(Identifier id, @Nullable Expression init) {
        this.id = id;
        this.init = init;
    }

    @Override
    public String type() {
        return "VariableDeclarator";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitVariableDeclarator(this);
    }
}
