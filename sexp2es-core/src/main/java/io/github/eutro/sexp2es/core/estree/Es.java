package io.github.eutro.sexp2es.core.estree;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static factories for ESTree shapes the lowering produces over and over.
 */
public final class Es {
    private Es() {
    }

    @Contract(pure = true)
    public static Identifier identifier(@NotNull String name) {
        return new Identifier(name);
    }

    @Contract(pure = true)
    public static Literal literal(@Nullable Object value) {
        return new Literal(value);
    }

    /**
     * The canonical absent value, {@code void 0}.
     *
     * @return The expression.
     */
    @Contract(pure = true)
    public static Expression voidZero() {
        return new UnaryExpression("void", literal(0));
    }

    public static MemberExpression member(Expression object, String property) {
        return new MemberExpression(object, identifier(property), false);
    }

    public static MemberExpression index(Expression object, int index) {
        return new MemberExpression(object, literal(index), true);
    }

    public static CallExpression call(Expression callee, List<Expression> arguments) {
        return new CallExpression(callee, arguments);
    }

    public static CallExpression call(Expression callee, Expression... arguments) {
        return call(callee, new ArrayList<>(Arrays.asList(arguments)));
    }

    public static BlockStatement block(List<Statement> body) {
        return new BlockStatement(body);
    }

    public static BlockStatement block(Statement... body) {
        return block(new ArrayList<>(Arrays.asList(body)));
    }

    public static FunctionExpression function(@Nullable String name, List<Identifier> params, List<Statement> body) {
        return new FunctionExpression(name == null ? null : identifier(name), params, block(body));
    }

    /**
     * Wrap statements in an immediately invoked, parameterless function, so
     * they can appear where an expression is expected.
     *
     * @param body The statements.
     * @return The invocation.
     */
    public static CallExpression iife(List<Statement> body) {
        return call(function(null, new ArrayList<>(), body), new ArrayList<>());
    }

    public static VariableDeclaration var(String name, @Nullable Expression init) {
        List<VariableDeclarator> declarators = new ArrayList<>(1);
        declarators.add(new VariableDeclarator(identifier(name), init));
        return new VariableDeclaration(declarators);
    }

    public static AssignmentExpression assign(Expression left, Expression right) {
        return new AssignmentExpression("=", left, right);
    }

    public static ExpressionStatement stmt(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static ReturnStatement ret(@Nullable Expression argument) {
        return new ReturnStatement(argument);
    }

    public static Property property(String key, Expression value) {
        return new Property(identifier(key), value, false);
    }

    public static ObjectExpression object(Property... properties) {
        return new ObjectExpression(new ArrayList<>(Arrays.asList(properties)));
    }

    public static ArrayExpression array(List<Expression> elements) {
        return new ArrayExpression(elements);
    }

    /**
     * A reference to {@code Array.prototype.slice}, applied to {@code arguments} from {@code from}.
     *
     * @param from The index of the first argument to keep.
     * @return The expression.
     */
    public static CallExpression sliceArguments(int from) {
        MemberExpression slice = member(member(member(identifier("Array"), "prototype"), "slice"), "call");
        return call(slice, identifier("arguments"), literal(from));
    }

    /**
     * Set the location of {@code node}, unless it already has one.
     *
     * @param node The node.
     * @param loc  The location, possibly null.
     * @param <N>  The type of the node.
     * @return The node.
     */
    public static <N extends EsNode> N at(N node, @Nullable SourceLocation loc) {
        if (node.loc == null) node.loc = loc;
        return node;
    }

    public static List<Statement> statements(Statement... statements) {
        return statements.length == 0 ? new ArrayList<>() : new ArrayList<>(Arrays.asList(statements));
    }
}
