package io.github.eutro.sexp2es.test;

import io.github.eutro.sexp2es.core.estree.CallExpression;
import io.github.eutro.sexp2es.core.estree.Program;
import io.github.eutro.sexp2es.core.estree.Statement;
import io.github.eutro.sexp2es.core.passes.convert.IrToEs;
import io.github.eutro.sexp2es.core.passes.convert.NamespaceEmitter;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static io.github.eutro.sexp2es.core.ir.Forms.*;
import static org.junit.jupiter.api.Assertions.*;

public class NamespaceEmitterTest {
    @Test
    void testResolveRelative() {
        assertEquals("./d/e", NamespaceEmitter.resolve("a.b.c", "a.b.d.e"));
        assertEquals("./baz", NamespaceEmitter.resolve("foo.bar", "foo.baz"));
        assertEquals("./../x", NamespaceEmitter.resolve("a.b.c", "a.x"));
        assertEquals("./c/d", NamespaceEmitter.resolve("a.b", "a.c.d"));
    }

    @Test
    void testResolveAbsolute() {
        assertEquals("x/y", NamespaceEmitter.resolve("a.b", "x.y"));
        assertEquals("string", NamespaceEmitter.resolve("a.b", "string"));
    }

    @Test
    void testResolveSelfIsAbsolute() {
        assertEquals("a/b", NamespaceEmitter.resolve("a.b", "a.b"));
        assertFalse(NamespaceEmitter.resolve("a.b.c", "a.b.c").startsWith("."));
    }

    @Test
    void testLocalName() {
        assertEquals("foo_bar", NamespaceEmitter.localName("foo.bar"));
        assertEquals("wisp_sequence", NamespaceEmitter.localName("wisp.sequence"));
    }

    @Test
    void testEmit() {
        List<Statement> statements = NamespaceEmitter.emit(ns("foo.bar", "Docs.",
                require("foo.baz", "baz", refer("qux", null), refer("make-thing", "thing")),
                require("wisp.string", null)));
        assertEquals(6, statements.size());
        assertEquals("var _ns_ = ({id: \"foo.bar\", doc: \"Docs.\"});", JsPrinter.print(statements.get(0)));
        assertEquals("var foo_baz = require(\"./baz\");", JsPrinter.print(statements.get(1)));
        assertEquals("var baz = foo_baz;", JsPrinter.print(statements.get(2)));
        assertEquals("var qux = foo_baz.qux;", JsPrinter.print(statements.get(3)));
        assertEquals("var thing = foo_baz.makeThing;", JsPrinter.print(statements.get(4)));
        assertEquals("var wisp_string = require(\"wisp/string\");", JsPrinter.print(statements.get(5)));
    }

    @Test
    void testEmitWithoutDoc() {
        List<Statement> statements = NamespaceEmitter.emit(ns("foo.bar", null));
        assertEquals(1, statements.size());
        assertEquals("var _ns_ = ({id: \"foo.bar\", doc: (void 0)});", JsPrinter.print(statements.get(0)));
    }

    @Test
    void testNsIsSplicedIntoProgram() {
        Program program = IrToEs.INSTANCE.run(Collections.singletonList(
                ns("foo.bar", null, require("x.y", "y"))));
        assertEquals(3, program.body.size());
    }

    @Test
    void testNsInExpressionPosition() {
        assertInstanceOf(CallExpression.class, IrToEs.INSTANCE.writeExpression(ns("foo.bar", null)));
    }

    @Test
    void testNsRuns() {
        Object doc = Utils.run(ns("foo.bar", "Docs."), var("_ns_.doc"));
        assertEquals("Docs.", String.valueOf(doc));
    }
}
