package io.github.eutro.sexp2es.core.ir;

import io.github.eutro.sexp2es.core.ext.CommonExts;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static factories for building IR by hand, for tools that synthesize forms
 * and for tests.
 */
public final class Forms {
    private Forms() {
    }

    /**
     * Attach a source location to a node.
     *
     * @param node The node.
     * @param loc  The location.
     * @param <N>  The type of the node.
     * @return The node, for chaining.
     */
    public static <N extends Node> N at(N node, Location loc) {
        node.attachExt(CommonExts.LOCATION, loc);
        return node;
    }

    public static NilNode nil() {
        return new NilNode();
    }

    /**
     * Construct a constant node, inferring its type from the class of {@code value}.
     *
     * @param value The value.
     * @return The node.
     */
    public static ConstantNode constant(@Nullable Object value) {
        ConstantNode.Type type;
        if (value == null) {
            type = ConstantNode.Type.NIL;
        } else if (value instanceof Boolean) {
            type = ConstantNode.Type.BOOLEAN;
        } else if (value instanceof Number) {
            type = ConstantNode.Type.NUMBER;
        } else if (value instanceof String) {
            type = ConstantNode.Type.STRING;
        } else if (value instanceof ConstantNode.RegExp) {
            type = ConstantNode.Type.REGEXP;
        } else {
            throw new IllegalArgumentException("not a constant: " + value.getClass().getName());
        }
        return new ConstantNode(value, type);
    }

    public static ConstantNode regexp(String pattern, String flags) {
        return constant(new ConstantNode.RegExp(pattern, flags));
    }

    public static KeywordNode keyword(String name) {
        return new KeywordNode(name);
    }

    public static VarNode var(String name) {
        return new VarNode(name);
    }

    public static VectorNode vector(Node... items) {
        return new VectorNode(Arrays.asList(items));
    }

    public static DictionaryNode dictionary(List<Node> keys, List<Node> values) {
        return new DictionaryNode(keys, values);
    }

    public static InvokeNode invoke(Node callee, Node... params) {
        return new InvokeNode(callee, Arrays.asList(params));
    }

    /**
     * Construct an application of the function with the given source name.
     *
     * @param callee The name of the function.
     * @param params The arguments.
     * @return The node.
     */
    public static InvokeNode invoke(String callee, Node... params) {
        return invoke(var(callee), params);
    }

    public static NewNode newNode(Node constructor, Node... params) {
        return new NewNode(constructor, Arrays.asList(params));
    }

    public static DefNode def(String name, @Nullable Node init) {
        return new DefNode(var(name), init);
    }

    public static SetNode set(Node target, Node value) {
        return new SetNode(target, value);
    }

    public static MemberAccessNode member(Node target, String property) {
        return new MemberAccessNode(target, var(property), false);
    }

    public static MemberAccessNode computed(Node target, Node property) {
        return new MemberAccessNode(target, property, true);
    }

    public static IfNode ifNode(Node test, Node consequent, @Nullable Node alternate) {
        return new IfNode(test, consequent, alternate);
    }

    public static ThrowNode throwNode(Node value) {
        return new ThrowNode(value);
    }

    public static TryNode tryNode(Node body, @Nullable String catchName, @Nullable Node handler, @Nullable Node finalizer) {
        return new TryNode(body, handler == null ? null : new TryNode.Handler(catchName, handler), finalizer);
    }

    public static DoNode doNode(@Nullable Node result, Node... statements) {
        return new DoNode(Arrays.asList(statements), result);
    }

    public static Binding binding(String name, Node init) {
        return new Binding(name, init);
    }

    public static LetNode let(List<Binding> bindings, @Nullable Node result, Node... statements) {
        return new LetNode(bindings, Arrays.asList(statements), result);
    }

    public static LoopNode loop(List<Binding> bindings, @Nullable Node result, Node... statements) {
        return new LoopNode(bindings, Arrays.asList(statements), result);
    }

    public static RecurNode recur(Node... params) {
        return new RecurNode(Arrays.asList(params));
    }

    /**
     * Construct a function method, computing its arity from its parameters.
     *
     * @param params     The declared parameters, the last being the rest parameter if {@code variadic}.
     * @param variadic   Whether the method is variadic.
     * @param result     The result expression.
     * @param statements The statements evaluated before the result.
     * @return The method.
     */
    public static FnNode.Method method(List<String> params, boolean variadic, @Nullable Node result, Node... statements) {
        int arity = variadic ? params.size() - 1 : params.size();
        return new FnNode.Method(params, variadic, arity, Arrays.asList(statements), result);
    }

    public static FnNode fn(@Nullable String name, FnNode.Method... methods) {
        return new FnNode(name, Arrays.asList(methods));
    }

    public static NsNode ns(String name, @Nullable String doc, NsNode.Require... requires) {
        return new NsNode(name, doc, Arrays.asList(requires));
    }

    public static NsNode.Require require(String ns, @Nullable String alias, NsNode.Refer... refer) {
        return new NsNode.Require(ns, alias, Arrays.asList(refer));
    }

    public static NsNode.Refer refer(String name, @Nullable String rename) {
        return new NsNode.Refer(name, rename);
    }

    public static List<String> names(String... names) {
        return names.length == 0 ? Collections.emptyList() : Arrays.asList(names);
    }
}
