package io.github.eutro.sexp2es.core.estree;

public final class CatchClause extends EsNode {
    public final Identifier param;
    public final BlockStatement body;

    public CatchClause(Identifier param, BlockStatement body) {
        this.param = param;
        this.body = body;
    }

    @Override
    public String type() {
        return "CatchClause";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitCatchClause(this);
    }
}
