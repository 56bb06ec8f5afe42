package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A function, with one or more methods distinguished by arity.
 * <p>
 * The analyzer guarantees that at most one method is variadic, and that
 * it has the largest arity.
 */
public final class FnNode extends Node {
    @Nullable
    public final String name;
    public final List<Method> methods;

    public FnNode(@Nullable String name, List<Method> methods) {
        this.name = name;
        this.methods = methods;
    }

    @Override
    public String kind() {
        return "fn";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFn(this);
    }

    public static final class Method {
        /**
         * The declared parameter names. For a variadic method the last one is the rest parameter.
         */
        public final List<String> params;
        public final boolean variadic;
        /**
         * The number of fixed parameters.
         */
        public final int arity;
        public final List<Node> statements;
        @Nullable
        public final Node result;

        public Method(List<String> params, boolean variadic, int arity, List<Node> statements, @Nullable Node result) {
            this.params = params;
            this.variadic = variadic;
            this.arity = arity;
            this.statements = statements;
            this.result = result;
        }
    }
}
