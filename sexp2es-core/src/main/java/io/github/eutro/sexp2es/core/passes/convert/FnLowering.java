package io.github.eutro.sexp2es.core.passes.convert;

import io.github.eutro.sexp2es.core.estree.*;
import io.github.eutro.sexp2es.core.ir.FnNode;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.sexp2es.core.estree.Es.*;

/**
 * Lowers {@code fn}.
 * <p>
 * A function with one method takes its fixed parameters directly. A function with
 * several dispatches on {@code arguments.length}:
 * <pre>{@code
 * function () {
 *     switch (arguments.length) {
 *         case 1:
 *             var x = arguments[0];
 *             return x;
 *         case 2:
 *             var x = arguments[0];
 *             var y = arguments[1];
 *             return x + y;
 *         default:
 *             throw new RangeError("Wrong number of arguments passed");
 *     }
 * }
 * }</pre>
 * A variadic method, if there is one, is the {@code default} case instead.
 */
final class FnLowering {
    static final String ARITY_ERROR = "Wrong number of arguments passed";

    private FnLowering() {
    }

    static Expression write(Lowering lowering, FnNode node) {
        String name = node.name == null ? null : lowering.mangle(node.name);
        if (node.methods.size() == 1) {
            FnNode.Method method = node.methods.get(0);
            List<Identifier> params = new ArrayList<>(method.arity);
            for (int i = 0; i < method.arity; i++) {
                params.add(lowering.bindingName(method.params.get(i)));
            }
            List<Statement> body = new ArrayList<>();
            bindRest(lowering, method, body);
            body.addAll(lowering.writeBody(method.statements, method.result));
            return function(name, params, body);
        }

        List<SwitchCase> cases = new ArrayList<>();
        FnNode.Method variadic = null;
        for (FnNode.Method method : node.methods) {
            if (method.variadic) {
                variadic = method;
            } else {
                cases.add(new SwitchCase(literal(method.arity), dispatchedBody(lowering, method)));
            }
        }
        if (variadic != null) {
            cases.add(new SwitchCase(null, dispatchedBody(lowering, variadic)));
        } else {
            List<Expression> message = new ArrayList<>();
            message.add(literal(ARITY_ERROR));
            NewExpression error = new NewExpression(identifier("RangeError"), message);
            cases.add(new SwitchCase(null, statements(new ThrowStatement(error))));
        }
        SwitchStatement dispatch = new SwitchStatement(member(identifier("arguments"), "length"), cases);
        return function(name, new ArrayList<>(), statements(dispatch));
    }

    private static List<Statement> dispatchedBody(Lowering lowering, FnNode.Method method) {
        List<Statement> body = new ArrayList<>();
        for (int i = 0; i < method.arity; i++) {
            body.add(var(lowering.mangle(method.params.get(i)), index(identifier("arguments"), i)));
        }
        bindRest(lowering, method, body);
        body.addAll(lowering.writeBody(method.statements, method.result));
        if (method.result == null) {
            body.add(ret(voidZero()));
        }
        return body;
    }

    private static void bindRest(Lowering lowering, FnNode.Method method, List<Statement> body) {
        if (!method.variadic) return;
        String rest = method.params.get(method.arity);
        body.add(var(lowering.mangle(rest), sliceArguments(method.arity)));
    }
}
