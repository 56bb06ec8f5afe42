package io.github.eutro.sexp2es.test;

import io.github.eutro.sexp2es.core.estree.*;
import io.github.eutro.sexp2es.core.ir.FnNode;
import io.github.eutro.sexp2es.core.ir.Node;
import io.github.eutro.sexp2es.core.passes.convert.IrToEs;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.JavaScriptException;

import java.util.List;

import static io.github.eutro.sexp2es.core.ir.Forms.*;
import static org.junit.jupiter.api.Assertions.*;

public class FnLoweringTest {
    private static FunctionExpression write(Node node) {
        return (FunctionExpression) IrToEs.INSTANCE.writeExpression(node);
    }

    private static final FnNode ONE_OR_TWO = fn(null,
            method(names("x"), false, invoke("*", var("x"), constant(10))),
            method(names("x", "y"), false, invoke("+", var("x"), var("y"))));

    @Test
    void testSingleMethodTakesParameters() {
        FunctionExpression fn = write(fn(null, method(names("a", "b"), false, invoke("+", var("a"), var("b")))));
        assertEquals(2, fn.params.size());
        assertEquals("a", fn.params.get(0).name);
        assertEquals("b", fn.params.get(1).name);
        assertEquals(3.0, Utils.runNumber(invoke(
                fn(null, method(names("a", "b"), false, invoke("+", var("a"), var("b")))),
                constant(1), constant(2))));
    }

    @Test
    void testParameterNamesAreTranslated() {
        FunctionExpression fn = write(fn(null, method(names("is-ok?"), false, var("is-ok?"))));
        assertEquals("isIsOk", fn.params.get(0).name);
    }

    @Test
    void testSingleVariadic() {
        FnNode count = fn(null, method(names("a", "more"), true, member(var("more"), "length")));
        FunctionExpression fn = write(count);
        assertEquals(1, fn.params.size());
        assertEquals("var more = Array.prototype.slice.call(arguments, 1);", JsPrinter.print(fn.body.body.get(0)));
        assertEquals(2.0, Utils.runNumber(invoke(count, constant(1), constant(2), constant(3))));
        assertEquals(0.0, Utils.runNumber(invoke(count, constant(1))));
    }

    @Test
    void testDispatchShape() {
        FunctionExpression fn = write(ONE_OR_TWO);
        assertTrue(fn.params.isEmpty());
        assertEquals(1, fn.body.body.size());
        SwitchStatement dispatch = (SwitchStatement) fn.body.body.get(0);
        assertEquals("arguments.length", JsPrinter.print(dispatch.discriminant));
        assertEquals(3, dispatch.cases.size());
        assertEquals(1, ((Literal) dispatch.cases.get(0).test).value);
        assertEquals(2, ((Literal) dispatch.cases.get(1).test).value);
        assertNull(dispatch.cases.get(2).test);
    }

    @Test
    void testDispatchesOnArity() {
        assertEquals(50.0, Utils.runNumber(invoke(ONE_OR_TWO, constant(5))));
        assertEquals(7.0, Utils.runNumber(invoke(ONE_OR_TWO, constant(5), constant(2))));
    }

    @Test
    void testWrongArityThrowsAtRunTime() {
        for (Node call : new Node[]{
                invoke(ONE_OR_TWO),
                invoke(ONE_OR_TWO, constant(1), constant(2), constant(3)),
        }) {
            JavaScriptException e = assertThrows(JavaScriptException.class, () -> Utils.run(call));
            assertEquals("RangeError: Wrong number of arguments passed", e.details());
        }
    }

    @Test
    void testVariadicIsDefault() {
        FnNode fn = fn(null,
                method(names("x"), false, constant("one")),
                method(names("x", "rest"), true, member(var("rest"), "length")));
        SwitchStatement dispatch = (SwitchStatement) write(fn).body.body.get(0);
        assertEquals(2, dispatch.cases.size());
        assertNull(dispatch.cases.get(1).test);

        assertEquals("one", String.valueOf(Utils.run(invoke(fn, constant(1)))));
        assertEquals(2.0, Utils.runNumber(invoke(fn, constant(1), constant(2), constant(3))));
        assertEquals(0.0, Utils.runNumber(invoke(fn)));
    }

    @Test
    void testCasesAlwaysReturn() {
        FnNode fn = fn(null,
                method(names(), false, null, invoke("f")),
                method(names("x"), false, var("x")));
        SwitchStatement dispatch = (SwitchStatement) write(fn).body.body.get(0);
        List<Statement> first = dispatch.cases.get(0).consequent;
        assertEquals("return (void 0);", JsPrinter.print(first.get(first.size() - 1)));
        List<Statement> second = dispatch.cases.get(1).consequent;
        assertEquals("var x = arguments[0];", JsPrinter.print(second.get(0)));
        assertEquals("return x;", JsPrinter.print(second.get(1)));
    }

    @Test
    void testNamedFnRecurses() {
        FnNode fact = fn("fact", method(names("n"), false,
                ifNode(invoke("<", var("n"), constant(2)),
                        constant(1),
                        invoke("*", var("n"), invoke("fact", invoke("-", var("n"), constant(1)))))));
        FunctionExpression fn = write(fact);
        assertNotNull(fn.id);
        assertEquals("fact", fn.id.name);
        assertEquals(120.0, Utils.runNumber(invoke(fact, constant(5))));
    }
}
