package io.github.eutro.sexp2es.core.estree;

import java.util.List;

/**
 * A {@code var} declaration. Only function-scoped declarations are produced.
 */
public final class VariableDeclaration extends Statement {
    public final List<VariableDeclarator> declarations;
    public final String kind = "var";

    public VariableDeclaration(List<VariableDeclarator> declarations) {
        this.declarations = declarations;
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }
}
