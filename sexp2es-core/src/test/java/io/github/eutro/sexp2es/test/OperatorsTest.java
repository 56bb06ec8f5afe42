package io.github.eutro.sexp2es.test;

import io.github.eutro.sexp2es.core.ArityMismatchException;
import io.github.eutro.sexp2es.core.estree.*;
import io.github.eutro.sexp2es.core.ir.Node;
import io.github.eutro.sexp2es.core.ops.SpecialForms;
import io.github.eutro.sexp2es.core.passes.convert.IrToEs;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.sexp2es.core.ir.Forms.*;
import static org.junit.jupiter.api.Assertions.*;

public class OperatorsTest {
    private static Expression write(Node node) {
        return IrToEs.INSTANCE.writeExpression(node);
    }

    private static String print(Node node) {
        return JsPrinter.print(write(node));
    }

    @Test
    void testArithmeticIdentities() {
        Expression sum = write(invoke("+"));
        assertInstanceOf(Literal.class, sum);
        assertEquals(0, ((Literal) sum).value);

        Expression product = write(invoke("*"));
        assertInstanceOf(Literal.class, product);
        assertEquals(1, ((Literal) product).value);
    }

    @Test
    void testArithmeticArity() {
        ArityMismatchException e = assertThrows(ArityMismatchException.class, () -> write(invoke("-")));
        assertEquals("Wrong number of arguments (0) passed to: -", e.getMessage());
        assertEquals("-", e.getOperator());
        assertEquals(0, e.getGot());

        assertThrows(ArityMismatchException.class, () -> write(invoke("/")));
        assertThrows(ArityMismatchException.class, () -> write(invoke("mod", constant(1), constant(2), constant(3))));
        assertThrows(ArityMismatchException.class, () -> write(invoke("mod", constant(1))));
    }

    @Test
    void testArithmeticFolds() {
        assertEquals("(0 - x)", print(invoke("-", var("x"))));
        assertEquals("(1 / x)", print(invoke("/", var("x"))));
        assertEquals("(0 + x)", print(invoke("+", var("x"))));
        assertEquals("((a + b) + c)", print(invoke("+", var("a"), var("b"), var("c"))));
        assertEquals("(a % b)", print(invoke("mod", var("a"), var("b"))));
        assertEquals(7.0, Utils.runNumber(invoke("-", constant(10), constant(2), constant(1))));
    }

    @Test
    void testLogical() {
        Expression and = write(invoke("and"));
        assertInstanceOf(Literal.class, and);
        assertEquals(true, ((Literal) and).value);
        assertEquals("(void 0)", print(invoke("or")));
        assertEquals("a", print(invoke("or", var("a"))));
        assertEquals("((a || b) || c)", print(invoke("or", var("a"), var("b"), var("c"))));
        assertEquals("(a && b)", print(invoke("and", var("a"), var("b"))));
    }

    @Test
    void testUnary() {
        assertEquals("(! a)", print(invoke("not", var("a"))));
        assertEquals("(~ a)", print(invoke("bit-not", var("a"))));
        assertThrows(ArityMismatchException.class, () -> write(invoke("not", var("a"), var("b"))));
        assertThrows(ArityMismatchException.class, () -> write(invoke("bit-not")));
    }

    @Test
    void testBitwise() {
        assertEquals("((a & b) & c)", print(invoke("bit-and", var("a"), var("b"), var("c"))));
        assertEquals("(a >>> b)", print(invoke("bit-shift-right-unsigned", var("a"), var("b"))));
        assertEquals("(a << b)", print(invoke("bit-shift-left", var("a"), var("b"))));
        assertThrows(ArityMismatchException.class, () -> write(invoke("bit-or", var("a"))));
    }

    @Test
    void testComparison() {
        assertEquals("(a === b)", print(invoke("==", var("a"), var("b"))));
        assertEquals("(a < b)", print(invoke("<", var("a"), var("b"))));
        assertThrows(ArityMismatchException.class, () -> write(invoke("<")));
    }

    @Test
    void testComparisonOfOne() {
        Expression expr = write(invoke("<", var("x")));
        assertInstanceOf(SequenceExpression.class, expr);
        assertEquals("(x, true)", JsPrinter.print(expr));

        // the operand is still evaluated
        assertEquals(5.0, Utils.runNumber(
                def("n", constant(0)),
                ifNode(invoke("<", set(var("n"), constant(5))), var("n"), constant(0))));
    }

    @Test
    void testChainedComparisonSharesMiddle() {
        Expression expr = write(invoke("<", var("a"), var("b"), var("c")));
        assertEquals("((a < b) && (b < c))", JsPrinter.print(expr));
        LogicalExpression and = (LogicalExpression) expr;
        BinaryExpression left = (BinaryExpression) and.left;
        BinaryExpression right = (BinaryExpression) and.right;
        assertSame(left.right, right.left);

        assertEquals(true, Utils.run(invoke("<", constant(1), constant(2), constant(3))));
        assertEquals(false, Utils.run(invoke("<", constant(1), constant(3), constant(2))));
    }

    @Test
    void testIdentityAndType() {
        assertEquals("(a === b)", print(invoke("identical?", var("a"), var("b"))));
        assertThrows(ArityMismatchException.class, () -> write(invoke("identical?", var("a"))));
        assertEquals("(x instanceof Foo)", print(invoke("instance?", var("Foo"), var("x"))));
        assertEquals("((void 0) instanceof Foo)", print(invoke("instance?", var("Foo"))));
        assertThrows(ArityMismatchException.class, () -> write(invoke("instance?")));
    }

    @Test
    void testLastInstallWins() {
        SpecialForms forms = SpecialForms.defaults().toBuilder()
                .install("+", (form, writer) -> Es.literal("replaced"))
                .build();
        Expression expr = new IrToEs(forms).writeExpression(invoke("+", var("a")));
        assertEquals("\"replaced\"", JsPrinter.print(expr));
        // the defaults are untouched
        assertEquals("(0 + a)", print(invoke("+", var("a"))));
    }

    @Test
    void testNamesInInstallationOrder() {
        SpecialForms forms = SpecialForms.defaults().toBuilder()
                .install("str", (form, writer) -> Es.literal(""))
                .build();
        List<String> names = new ArrayList<>(forms.names());
        assertEquals("or", names.get(0));
        assertEquals("str", names.get(names.size() - 1));
        assertTrue(names.contains("instance?"));
    }

    @Test
    void testRemovedFormIsACall() {
        SpecialForms forms = SpecialForms.defaults().toBuilder().remove("+").build();
        assertFalse(forms.contains("+"));
        assertEquals("sum(a, b)", JsPrinter.print(new IrToEs(forms).writeExpression(invoke("+", var("a"), var("b")))));
    }

    @Test
    void testOnlyNamedCalleesAreForms() {
        assertEquals("f.not(a)", print(invoke(member(var("f"), "not"), var("a"))));
    }
}
