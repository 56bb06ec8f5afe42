package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A module-level definition.
 */
public final class DefNode extends Node {
    public final VarNode var;
    @Nullable
    public final Node init;

    public DefNode(VarNode var, @Nullable Node init) {
        this.var = var;
        this.init = init;
    }

    @Override
    public String kind() {
        return "def";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDef(this);
    }
}
