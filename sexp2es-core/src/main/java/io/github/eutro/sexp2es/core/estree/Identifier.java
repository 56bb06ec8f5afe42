package io.github.eutro.sexp2es.core.estree;

public final class Identifier extends Expression {
    public final String name;

    public Identifier(String name) {
        this.name = name;
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public <R> R accept(EsVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
