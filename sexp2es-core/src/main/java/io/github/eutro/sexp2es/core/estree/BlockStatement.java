package io.github.eutro.sexp2es.core.estree;

import java.util.List;

public final class BlockStatement extends Statement {
    public final List<Statement> body;

    public BlockStatement(List<Statement> body) {
        this.body = body;
    }

    @Override
    public String type() {
        return "BlockStatement";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitBlockStatement(this);
    }
}
