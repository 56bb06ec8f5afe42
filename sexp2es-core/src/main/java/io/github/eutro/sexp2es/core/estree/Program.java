package io.github.eutro.sexp2es.core.estree;

import java.util.List;

/**
 * The root of a lowered compilation unit.
 */
public final class Program extends EsNode {
    public final List<Statement> body;
    public final String sourceType = "script";

    public Program(List<Statement> body) {
        this.body = body;
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
