package io.github.eutro.sexp2es.api;

import io.github.eutro.sexp2es.api.bits.Bit;
import io.github.eutro.sexp2es.api.events.*;
import io.github.eutro.sexp2es.api.printer.PrinterOptions;
import io.github.eutro.sexp2es.core.CompileException;
import io.github.eutro.sexp2es.core.estree.Program;
import io.github.eutro.sexp2es.core.ir.Node;
import io.github.eutro.sexp2es.core.ops.SpecialForm;
import io.github.eutro.sexp2es.core.ops.SpecialForms;
import io.github.eutro.sexp2es.core.passes.convert.IrToEs;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Represents the compilation of a single analyzed program.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunProgramCompilationEvent} is fired on the {@link EsCompiler compiler}.</li>
 *     <li>{@link ModifySpecialFormsEvent} is fired.</li>
 *     <li>The forms are {@link IrToEs lowered to a program} with the special forms.</li>
 *     <li>{@link ProgramPassesEvent} is fired.</li>
 *     <li>{@link ModifyPrinterOptionsEvent} is fired.</li>
 *     <li>{@link EmitProgramEvent} is fired.</li>
 * </ol>
 * If lowering fails, nothing is emitted and the exception propagates out of {@link #run()}.
 */
public class ProgramCompilation extends EventSupplier<ProgramCompileEvent> {
    private static final Logger LOGGER = Logger.getLogger(ProgramCompilation.class.getName());

    private final EsCompiler cc;

    /**
     * The top-level forms being compiled.
     */
    @NotNull
    public List<Node> forms;

    /**
     * The name of the source file, recorded in output locations, or null.
     */
    @Nullable
    public String source;

    /**
     * Construct a new program compilation in the given compiler for the given forms.
     *
     * @param cc    The compiler.
     * @param forms The forms being compiled.
     */
    ProgramCompilation(EsCompiler cc, @NotNull List<Node> forms) {
        this.cc = cc;
        this.forms = forms;
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @throws CompileException If the forms cannot be lowered.
     */
    public void run() {
        LOGGER.log(Level.FINE, "compiling {0} forms from {1}", new Object[]{forms.size(), source});
        try {
            cc.dispatch(RunProgramCompilationEvent.class, new RunProgramCompilationEvent(this));
            SpecialForms specialForms = dispatch(ModifySpecialFormsEvent.class,
                    new ModifySpecialFormsEvent(SpecialForms.defaults().toBuilder()))
                    .forms
                    .build();

            Program program = new IrToEs(specialForms, source).run(forms);
            program = dispatch(ProgramPassesEvent.class, new ProgramPassesEvent(program)).program;

            PrinterOptions options = dispatch(ModifyPrinterOptionsEvent.class,
                    new ModifyPrinterOptionsEvent(PrinterOptions.builder().setFile(source)))
                    .options
                    .build();
            EmitProgramEvent emitted = dispatch(EmitProgramEvent.class, new EmitProgramEvent(program, options));
            LOGGER.log(Level.FINE, "compiled {0}{1}", new Object[]{
                    source == null ? "program" : source,
                    emitted.isCancelled() ? ", emit cancelled" : ""
            });
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "failed to compile " + (source == null ? "program" : source), e);
            throw e;
        }
    }

    /**
     * Set the name of the source file of this compilation.
     *
     * @param source The name of the source file.
     * @return This, for convenience.
     */
    public ProgramCompilation setSource(@Nullable String source) {
        this.source = source;
        return this;
    }

    /**
     * Install a special form for just this compilation, by
     * {@link ModifySpecialFormsEvent modifying the special forms}.
     *
     * @param name The name the form is applied by.
     * @param form The form.
     * @return This, for convenience.
     */
    public ProgramCompilation install(String name, SpecialForm form) {
        listen(ModifySpecialFormsEvent.class, evt -> evt.forms.install(name, form));
        return this;
    }

    public <T> T add(Bit<? super ProgramCompilation, T> bit) {
        return bit.attachTo(this);
    }
}
