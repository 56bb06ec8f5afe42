package io.github.eutro.sexp2es.core.ir;

/**
 * A property access. A non-{@link #computed} access names its property with a {@link VarNode}.
 */
public final class MemberAccessNode extends Node {
    public final Node target;
    public final Node property;
    public final boolean computed;

    public MemberAccessNode(Node target, Node property, boolean computed) {
        this.target = target;
        this.property = property;
        this.computed = computed;
    }

    @Override
    public String kind() {
        return "member-access";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }
}
