package io.github.eutro.sexp2es.api;

import io.github.eutro.sexp2es.api.bits.OutputsToFile;
import io.github.eutro.sexp2es.api.events.*;
import io.github.eutro.sexp2es.api.printer.Printer;
import io.github.eutro.sexp2es.api.printer.PrinterOptions;
import io.github.eutro.sexp2es.core.ArityMismatchException;
import io.github.eutro.sexp2es.core.estree.Es;
import io.github.eutro.sexp2es.core.estree.ExpressionStatement;
import io.github.eutro.sexp2es.core.estree.Literal;
import io.github.eutro.sexp2es.core.estree.Program;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static io.github.eutro.sexp2es.core.ir.Forms.*;
import static org.junit.jupiter.api.Assertions.*;

public class EsCompilerTest {
    private static final Printer COUNTING_PRINTER = (program, options) ->
            options.getFile() + ": " + program.body.size() + " statements";

    @Test
    void testOutputsAsQueue() {
        EsCompiler cc = new EsCompiler();
        BlockingQueue<Program> outputs = cc.outputsAsQueue();
        cc.submit(def("a", constant(1)), var("a")).run();
        cc.submit(var("b")).run();
        assertEquals(2, outputs.size());
        assertEquals(2, outputs.poll().body.size());
        assertEquals(1, outputs.poll().body.size());
    }

    @Test
    void testEventOrder() {
        EsCompiler cc = new EsCompiler();
        List<String> fired = new ArrayList<>();
        cc.listen(RunProgramCompilationEvent.class, evt -> fired.add("run"));
        EventDispatcher<ProgramCompileEvent> all = cc.lift();
        all.listen(ModifySpecialFormsEvent.class, evt -> fired.add("forms"));
        all.listen(ProgramPassesEvent.class, evt -> fired.add("passes"));
        all.listen(ModifyPrinterOptionsEvent.class, evt -> fired.add("options"));
        all.listen(EmitProgramEvent.class, evt -> fired.add("emit"));
        cc.submit(var("x")).run();
        assertEquals(5, fired.size());
        assertEquals("run", fired.get(0));
        assertEquals("forms", fired.get(1));
        assertEquals("passes", fired.get(2));
        assertEquals("options", fired.get(3));
        assertEquals("emit", fired.get(4));
    }

    @Test
    void testInstallSpecialForm() {
        EsCompiler cc = new EsCompiler();
        BlockingQueue<Program> outputs = cc.outputsAsQueue();
        cc.submit(invoke("answer"))
                .install("answer", (form, writer) -> Es.literal(42))
                .run();
        ExpressionStatement statement = (ExpressionStatement) outputs.remove().body.get(0);
        assertEquals(42, ((Literal) statement.expression).value);
    }

    @Test
    void testSpecialFormsForEveryCompilation() {
        EsCompiler cc = new EsCompiler();
        cc.lift().listen(ModifySpecialFormsEvent.class, evt -> evt.forms.remove("+"));
        BlockingQueue<Program> outputs = cc.outputsAsQueue();
        cc.submit(invoke("+")).run();
        ExpressionStatement statement = (ExpressionStatement) outputs.remove().body.get(0);
        assertNotEquals("Literal", statement.expression.type());
    }

    @Test
    void testCancelledEmit() {
        EsCompiler cc = new EsCompiler();
        cc.lift().listen(EmitProgramEvent.class, EmitProgramEvent::cancel);
        BlockingQueue<Program> outputs = cc.outputsAsQueue();
        cc.submit(var("x")).run();
        assertTrue(outputs.isEmpty());
    }

    @Test
    void testPassesCanReplaceProgram() {
        EsCompiler cc = new EsCompiler();
        cc.lift().listen(ProgramPassesEvent.class, evt -> evt.program = new Program(new ArrayList<>()));
        BlockingQueue<Program> outputs = cc.outputsAsQueue();
        cc.submit(var("x")).run();
        assertTrue(outputs.remove().body.isEmpty());
    }

    @Test
    void testFailuresPropagate() {
        EsCompiler cc = new EsCompiler();
        BlockingQueue<Program> outputs = cc.outputsAsQueue();
        assertThrows(ArityMismatchException.class, () -> cc.submit(invoke("-")).run());
        assertTrue(outputs.isEmpty());
    }

    @Test
    void testOutputsToFile(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("out").resolve("core.js");
        ProgramCompilation compilation = new EsCompiler()
                .submit(var("a"), var("b"))
                .setSource("core.wisp");
        compilation.add(new OutputsToFile<ProgramCompilation>(out, COUNTING_PRINTER));
        compilation.run();
        assertEquals("core.wisp: 2 statements", new String(Files.readAllBytes(out), StandardCharsets.UTF_8));
    }

    @Test
    void testPrinterOptions() {
        EsCompiler cc = new EsCompiler();
        List<PrinterOptions> seen = new ArrayList<>();
        cc.lift().listen(ModifyPrinterOptionsEvent.class, evt -> evt.options.setIndentStyle("\t").setSemicolons(false));
        cc.lift().listen(EmitProgramEvent.class, evt -> seen.add(evt.options));
        cc.submit(var("x")).run();
        assertEquals(1, seen.size());
        assertEquals("\t", seen.get(0).getIndentStyle());
        assertFalse(seen.get(0).isSemicolons());
        assertTrue(seen.get(0).isParentheses());
        assertNull(seen.get(0).getFile());

        PrinterOptions copy = seen.get(0).toBuilder().setQuotes("double").build();
        assertEquals("double", copy.getQuotes());
        assertEquals("\t", copy.getIndentStyle());
        assertThrows(IllegalArgumentException.class, () -> PrinterOptions.builder().setQuotes("backtick"));
    }
}
