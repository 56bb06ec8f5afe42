package io.github.eutro.sexp2es.core.passes.convert;

import io.github.eutro.sexp2es.core.UnsupportedNodeException;
import io.github.eutro.sexp2es.core.estree.*;
import io.github.eutro.sexp2es.core.ir.*;
import io.github.eutro.sexp2es.core.ops.FormWriter;
import io.github.eutro.sexp2es.core.ops.SpecialForm;
import io.github.eutro.sexp2es.core.ops.SpecialForms;
import io.github.eutro.sexp2es.core.support.NameMangler;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.github.eutro.sexp2es.core.estree.Es.*;

/**
 * The state of lowering one program.
 * <p>
 * Expression position goes through {@link #write(Node)}, statement position through
 * {@link #writeStatement(Node, List)}. The structural helpers take the writer to lower
 * results with, so that the tail of a {@code loop} can reuse them.
 */
final class Lowering implements FormWriter, NodeVisitor<Expression> {
    /**
     * Lowers results to their plain values.
     */
    final ResultWriter values = result -> result == null ? null : write(result);

    private final SpecialForms forms;
    @Nullable
    private final String source;
    // every identifier emitted so far, for picking fresh names
    private final Set<String> names = new HashSet<>();

    Lowering(SpecialForms forms, @Nullable String source) {
        this.forms = forms;
        this.source = source;
    }

    @Override
    public Expression write(Node node) {
        Expression expr;
        SpecialForm form = specialFormOf(node);
        if (form != null) {
            expr = form.write((InvokeNode) node, this);
        } else {
            expr = node.accept(this);
        }
        return at(expr, locationOf(node));
    }

    @Nullable
    private SpecialForm specialFormOf(Node node) {
        if (!(node instanceof InvokeNode)) return null;
        Node callee = ((InvokeNode) node).callee;
        if (!(callee instanceof VarNode)) return null;
        return forms.get(((VarNode) callee).name);
    }

    /**
     * Lower a node in statement position, appending the statements to {@code out}.
     *
     * @param node The node.
     * @param out  The statement list.
     */
    void writeStatement(Node node, List<Statement> out) {
        SourceLocation loc = locationOf(node);
        if (node instanceof DefNode) {
            out.add(at(writeDefinition((DefNode) node), loc));
        } else if (node instanceof NsNode) {
            for (Statement statement : NamespaceEmitter.emit((NsNode) node)) {
                if (statement instanceof VariableDeclaration) {
                    for (VariableDeclarator declarator : ((VariableDeclaration) statement).declarations) {
                        names.add(declarator.id.name);
                    }
                }
                out.add(at(statement, loc));
            }
        } else {
            out.add(at(stmt(write(node)), loc));
        }
    }

    /**
     * Lower statements followed by a returned result.
     *
     * @param statements   The statements.
     * @param result       The result, or null if there is none.
     * @param resultWriter How to lower the result.
     * @return The function body.
     */
    List<Statement> writeBody(List<Node> statements, @Nullable Node result, ResultWriter resultWriter) {
        List<Statement> body = new ArrayList<>();
        for (Node statement : statements) {
            writeStatement(statement, body);
        }
        Expression value = resultWriter.write(result);
        if (value != null) {
            body.add(at(ret(value), result == null ? null : locationOf(result)));
        }
        return body;
    }

    List<Statement> writeBody(List<Node> statements, @Nullable Node result) {
        return writeBody(statements, result, values);
    }

    /**
     * Lower a node whose value a block returns, flattening a {@code do} into the block.
     */
    List<Statement> writeReturning(Node node, ResultWriter resultWriter) {
        if (node instanceof DoNode) {
            DoNode doNode = (DoNode) node;
            return writeBody(doNode.statements, doNode.result, resultWriter);
        }
        return writeBody(new ArrayList<>(), node, resultWriter);
    }

    Identifier bindingName(String name) {
        return identifier(mangle(name));
    }

    List<Identifier> bindingNames(List<Binding> bindings) {
        List<Identifier> names = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            names.add(bindingName(binding.name));
        }
        return names;
    }

    List<Expression> bindingInits(List<Binding> bindings) {
        List<Expression> inits = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            inits.add(write(binding.init));
        }
        return inits;
    }

    Expression writeIf(IfNode node, ResultWriter resultWriter) {
        return new ConditionalExpression(write(node.test),
                orVoid(resultWriter.write(node.consequent)),
                orVoid(resultWriter.write(node.alternate)));
    }

    Expression writeDo(DoNode node, ResultWriter resultWriter) {
        return iife(writeBody(node.statements, node.result, resultWriter));
    }

    Expression writeLet(LetNode node, ResultWriter resultWriter) {
        FunctionExpression fn = new FunctionExpression(null,
                bindingNames(node.bindings),
                block(writeBody(node.statements, node.result, resultWriter)));
        return call(fn, bindingInits(node.bindings));
    }

    Expression writeTry(TryNode node, ResultWriter resultWriter) {
        BlockStatement block = block(writeReturning(node.body, resultWriter));
        CatchClause handler = null;
        if (node.handler != null) {
            handler = new CatchClause(bindingName(node.handler.name),
                    block(writeReturning(node.handler.body, resultWriter)));
        }
        BlockStatement finalizer = null;
        if (node.finalizer != null) {
            List<Statement> effects = new ArrayList<>();
            if (node.finalizer instanceof DoNode) {
                DoNode doNode = (DoNode) node.finalizer;
                for (Node statement : doNode.statements) {
                    writeStatement(statement, effects);
                }
                if (doNode.result != null) writeStatement(doNode.result, effects);
            } else {
                writeStatement(node.finalizer, effects);
            }
            finalizer = block(effects);
        }
        if (handler == null && finalizer == null) {
            finalizer = block(new ArrayList<>());
        }
        return iife(statements(new TryStatement(block, handler, finalizer)));
    }

    private static Expression orVoid(@Nullable Expression expr) {
        return expr == null ? voidZero() : expr;
    }

    private VariableDeclaration writeDefinition(DefNode node) {
        String name = mangle(node.var.name);
        Expression init = node.init == null ? voidZero() : write(node.init);
        return var(name, assign(member(identifier("exports"), name), init));
    }

    @Nullable
    SourceLocation locationOf(Node node) {
        Location loc = node.getLocation();
        if (loc == null) return null;
        return new SourceLocation(source,
                new SourceLocation.Position(loc.startLine, loc.startColumn),
                new SourceLocation.Position(loc.endLine, loc.endColumn));
    }

    String mangle(String name) {
        String mangled = NameMangler.ES_IDENT.mangle(name);
        names.add(mangled);
        return mangled;
    }

    /**
     * Find a name no identifier lowered so far uses.
     *
     * @param base The preferred name.
     * @return {@code base}, or {@code base} with the first numeric suffix that is unused.
     */
    String freshName(String base) {
        String name = base;
        for (int i = 1; names.contains(name); i++) {
            name = base + i;
        }
        names.add(name);
        return name;
    }

    /**
     * How the result of a body is lowered.
     */
    @FunctionalInterface
    interface ResultWriter {
        /**
         * Lower a result.
         *
         * @param result The result, or null if the body has none.
         * @return The expression to return, or null to return nothing.
         */
        @Nullable
        Expression write(@Nullable Node result);
    }

    @Override
    public Expression visitNil(NilNode node) {
        return voidZero();
    }

    @Override
    public Expression visitConstant(ConstantNode node) {
        switch (node.type) {
            case NIL:
                return voidZero();
            case REGEXP:
                ConstantNode.RegExp re = (ConstantNode.RegExp) node.value;
                return new Literal(null, new Literal.Regex(re.pattern, re.flags));
            default:
                return literal(node.value);
        }
    }

    @Override
    public Expression visitKeyword(KeywordNode node) {
        return literal(node.name);
    }

    @Override
    public Expression visitVar(VarNode node) {
        String name = node.name;
        if (name.startsWith(".") || name.endsWith(".") || !name.contains(".") || name.contains("..")) {
            return identifier(mangle(name));
        }
        String[] segments = name.split("\\.");
        Expression expr = identifier(mangle(segments[0]));
        for (int i = 1; i < segments.length; i++) {
            expr = member(expr, mangle(segments[i]));
        }
        return expr;
    }

    @Override
    public Expression visitVector(VectorNode node) {
        return array(writeAll(node.items));
    }

    @Override
    public Expression visitDictionary(DictionaryNode node) {
        List<Property> properties = new ArrayList<>(node.keys.size());
        for (int i = 0; i < node.keys.size(); i++) {
            Expression key = write(node.keys.get(i));
            properties.add(new Property(key, write(node.values.get(i)), !isPropertyName(key)));
        }
        return new ObjectExpression(properties);
    }

    private static boolean isPropertyName(Expression key) {
        if (!(key instanceof Literal)) return false;
        Object value = ((Literal) key).value;
        return value instanceof String || value instanceof Number;
    }

    @Override
    public Expression visitInvoke(InvokeNode node) {
        return call(write(node.callee), writeAll(node.params));
    }

    @Override
    public Expression visitNew(NewNode node) {
        return new NewExpression(write(node.constructor), writeAll(node.params));
    }

    @Override
    public Expression visitDef(DefNode node) {
        return iife(statements(
                writeDefinition(node),
                ret(identifier(mangle(node.var.name)))));
    }

    @Override
    public Expression visitSet(SetNode node) {
        return assign(write(node.target), write(node.value));
    }

    @Override
    public Expression visitMemberAccess(MemberAccessNode node) {
        Expression target = write(node.target);
        if (!node.computed && node.property instanceof VarNode) {
            return new MemberExpression(target, bindingName(((VarNode) node.property).name), false);
        }
        return new MemberExpression(target, write(node.property), true);
    }

    @Override
    public Expression visitIf(IfNode node) {
        return writeIf(node, values);
    }

    @Override
    public Expression visitThrow(ThrowNode node) {
        return iife(statements(new ThrowStatement(write(node.value))));
    }

    @Override
    public Expression visitTry(TryNode node) {
        return writeTry(node, values);
    }

    @Override
    public Expression visitDo(DoNode node) {
        return writeDo(node, values);
    }

    @Override
    public Expression visitLet(LetNode node) {
        return writeLet(node, values);
    }

    @Override
    public Expression visitLoop(LoopNode node) {
        return LoopLowering.write(this, node);
    }

    @Override
    public Expression visitRecur(RecurNode node) {
        throw new UnsupportedNodeException(node);
    }

    @Override
    public Expression visitFn(FnNode node) {
        return FnLowering.write(this, node);
    }

    @Override
    public Expression visitNs(NsNode node) {
        List<Statement> body = new ArrayList<>();
        writeStatement(node, body);
        return iife(body);
    }
}
