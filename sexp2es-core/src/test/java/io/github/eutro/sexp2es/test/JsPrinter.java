package io.github.eutro.sexp2es.test;

import io.github.eutro.sexp2es.core.estree.*;

import java.util.List;

/**
 * A minimal source printer for tests, which parenthesizes every compound expression
 * so precedence never matters.
 */
public class JsPrinter implements EsVisitor<String> {
    public static final JsPrinter INSTANCE = new JsPrinter();

    public static String print(EsNode node) {
        return node.accept(INSTANCE);
    }

    private String join(List<? extends EsNode> nodes, String sep) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i != 0) sb.append(sep);
            sb.append(nodes.get(i).accept(this));
        }
        return sb.toString();
    }

    private String statements(List<Statement> body) {
        StringBuilder sb = new StringBuilder();
        for (Statement statement : body) {
            sb.append(statement.accept(this)).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String visitProgram(Program node) {
        return statements(node.body);
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name;
    }

    @Override
    public String visitLiteral(Literal node) {
        if (node.regex != null) {
            return "/" + node.regex.pattern + "/" + node.regex.flags;
        }
        Object value = node.value;
        if (value == null) return "null";
        if (value instanceof String) {
            String s = (String) value;
            StringBuilder sb = new StringBuilder("\"");
            for (char c : s.toCharArray()) {
                switch (c) {
                    case '"':
                        sb.append("\\\"");
                        break;
                    case '\\':
                        sb.append("\\\\");
                        break;
                    case '\n':
                        sb.append("\\n");
                        break;
                    default:
                        sb.append(c);
                }
            }
            return sb.append('"').toString();
        }
        String s = value.toString();
        return s.startsWith("-") ? "(" + s + ")" : s;
    }

    @Override
    public String visitArrayExpression(ArrayExpression node) {
        return "[" + join(node.elements, ", ") + "]";
    }

    @Override
    public String visitObjectExpression(ObjectExpression node) {
        return "({" + join(node.properties, ", ") + "})";
    }

    @Override
    public String visitProperty(Property node) {
        String key = node.key.accept(this);
        return (node.computed ? "[" + key + "]" : key) + ": " + node.value.accept(this);
    }

    @Override
    public String visitFunctionExpression(FunctionExpression node) {
        return "(function " + (node.id == null ? "" : node.id.name)
                + "(" + join(node.params, ", ") + ") "
                + node.body.accept(this) + ")";
    }

    @Override
    public String visitUnaryExpression(UnaryExpression node) {
        return "(" + node.operator + " " + node.argument.accept(this) + ")";
    }

    @Override
    public String visitBinaryExpression(BinaryExpression node) {
        return "(" + node.left.accept(this) + " " + node.operator + " " + node.right.accept(this) + ")";
    }

    @Override
    public String visitLogicalExpression(LogicalExpression node) {
        return "(" + node.left.accept(this) + " " + node.operator + " " + node.right.accept(this) + ")";
    }

    @Override
    public String visitAssignmentExpression(AssignmentExpression node) {
        return "(" + node.left.accept(this) + " " + node.operator + " " + node.right.accept(this) + ")";
    }

    @Override
    public String visitSequenceExpression(SequenceExpression node) {
        return "(" + join(node.expressions, ", ") + ")";
    }

    @Override
    public String visitConditionalExpression(ConditionalExpression node) {
        return "(" + node.test.accept(this) + " ? " + node.consequent.accept(this)
                + " : " + node.alternate.accept(this) + ")";
    }

    @Override
    public String visitCallExpression(CallExpression node) {
        return node.callee.accept(this) + "(" + join(node.arguments, ", ") + ")";
    }

    @Override
    public String visitNewExpression(NewExpression node) {
        return "(new " + node.callee.accept(this) + "(" + join(node.arguments, ", ") + "))";
    }

    @Override
    public String visitMemberExpression(MemberExpression node) {
        String object = node.object.accept(this);
        if (node.computed) return object + "[" + node.property.accept(this) + "]";
        return object + "." + node.property.accept(this);
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement node) {
        return node.expression.accept(this) + ";";
    }

    @Override
    public String visitBlockStatement(BlockStatement node) {
        return "{\n" + statements(node.body) + "}";
    }

    @Override
    public String visitReturnStatement(ReturnStatement node) {
        return node.argument == null ? "return;" : "return " + node.argument.accept(this) + ";";
    }

    @Override
    public String visitThrowStatement(ThrowStatement node) {
        return "throw " + node.argument.accept(this) + ";";
    }

    @Override
    public String visitTryStatement(TryStatement node) {
        StringBuilder sb = new StringBuilder("try ").append(node.block.accept(this));
        if (node.handler != null) sb.append(' ').append(node.handler.accept(this));
        if (node.finalizer != null) sb.append(" finally ").append(node.finalizer.accept(this));
        return sb.toString();
    }

    @Override
    public String visitCatchClause(CatchClause node) {
        return "catch (" + node.param.accept(this) + ") " + node.body.accept(this);
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node) {
        return node.kind + " " + join(node.declarations, ", ") + ";";
    }

    @Override
    public String visitVariableDeclarator(VariableDeclarator node) {
        return node.init == null ? node.id.accept(this) : node.id.accept(this) + " = " + node.init.accept(this);
    }

    @Override
    public String visitWhileStatement(WhileStatement node) {
        return "while (" + node.test.accept(this) + ") " + node.body.accept(this);
    }

    @Override
    public String visitIfStatement(IfStatement node) {
        String s = "if (" + node.test.accept(this) + ") " + node.consequent.accept(this);
        return node.alternate == null ? s : s + " else " + node.alternate.accept(this);
    }

    @Override
    public String visitSwitchStatement(SwitchStatement node) {
        return "switch (" + node.discriminant.accept(this) + ") {\n" + join(node.cases, "\n") + "\n}";
    }

    @Override
    public String visitSwitchCase(SwitchCase node) {
        String label = node.test == null ? "default:" : "case " + node.test.accept(this) + ":";
        return label + "\n" + statements(node.consequent);
    }
}
