package io.github.eutro.sexp2es.core.passes.convert;

import io.github.eutro.sexp2es.core.ArityMismatchException;
import io.github.eutro.sexp2es.core.estree.*;
import io.github.eutro.sexp2es.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.sexp2es.core.estree.Es.*;

/**
 * Lowers {@code loop} to a {@code while} loop driven by signals.
 * <p>
 * Each iteration evaluates the result of the loop in tail position, where {@code recur}
 * is allowed, to one of two signals:
 * <ul>
 *     <li>{@code {done: false, values: [...]}}, from a {@code recur}, to rebind and go again;</li>
 *     <li>{@code {done: true, value: v}}, from anything else, to return {@code v}.</li>
 * </ul>
 * <pre>{@code
 * (function (i) {
 *     var loop$;
 *     while (true) {
 *         loop$ = i < 5 ? {done: false, values: [i + 1]} : {done: true, value: i};
 *         if (loop$.done) { return loop$.value; }
 *         i = loop$.values[0];
 *     }
 * })(0)
 * }</pre>
 * All the arguments to a {@code recur} are evaluated before any binding is reassigned.
 * The signal is renamed with a numeric suffix if the loop already uses {@value #SIGNAL}.
 */
final class LoopLowering {
    static final String SIGNAL = "loop$";

    private LoopLowering() {
    }

    static Expression write(Lowering lowering, LoopNode node) {
        List<Identifier> bindings = lowering.bindingNames(node.bindings);
        List<Expression> inits = lowering.bindingInits(node.bindings);
        List<Statement> iteration = new ArrayList<>();
        for (Node statement : node.statements) {
            lowering.writeStatement(statement, iteration);
        }
        Tail tail = new Tail(lowering, node.bindings.size());
        Expression result = tail.write(node.result);

        // chosen last, so it cannot shadow anything the body reads
        String signal = lowering.freshName(SIGNAL);
        iteration.add(stmt(assign(identifier(signal), result)));
        iteration.add(new IfStatement(member(identifier(signal), "done"),
                block(ret(member(identifier(signal), "value"))),
                null));
        for (int i = 0; i < bindings.size(); i++) {
            iteration.add(stmt(assign(identifier(bindings.get(i).name), index(member(identifier(signal), "values"), i))));
        }

        List<Statement> body = statements(
                var(signal, null),
                new WhileStatement(literal(true), block(iteration)));
        FunctionExpression driver = new FunctionExpression(null, bindings, block(body));
        return call(driver, inits);
    }

    private static Expression done(Expression value) {
        return object(property("done", literal(true)), property("value", value));
    }

    private static Expression again(List<Expression> values) {
        return object(property("done", literal(false)), property("values", array(values)));
    }

    /**
     * Lowers results in tail position of a loop to signals.
     * <p>
     * Conditionals, blocks, local bindings and exception handlers pass tail position on to their results.
     * A nested {@code loop} or {@code fn} is an ordinary value, its own {@code recur}s target itself.
     */
    private static final class Tail implements Lowering.ResultWriter {
        private final Lowering lowering;
        private final int arity;

        Tail(Lowering lowering, int arity) {
            this.lowering = lowering;
            this.arity = arity;
        }

        @Override
        public Expression write(@Nullable Node result) {
            if (result == null) return done(voidZero());
            Expression signal;
            if (result instanceof RecurNode) {
                RecurNode recur = (RecurNode) result;
                if (recur.params.size() != arity) {
                    throw new ArityMismatchException("recur", recur.params.size(), recur);
                }
                signal = again(lowering.writeAll(recur.params));
            } else if (result instanceof IfNode) {
                signal = lowering.writeIf((IfNode) result, this);
            } else if (result instanceof DoNode) {
                signal = lowering.writeDo((DoNode) result, this);
            } else if (result instanceof LetNode) {
                signal = lowering.writeLet((LetNode) result, this);
            } else if (result instanceof TryNode) {
                signal = lowering.writeTry((TryNode) result, this);
            } else {
                return done(lowering.write(result));
            }
            return at(signal, lowering.locationOf(result));
        }
    }
}
