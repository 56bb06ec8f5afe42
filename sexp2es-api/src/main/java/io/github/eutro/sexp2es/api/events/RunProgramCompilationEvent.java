package io.github.eutro.sexp2es.api.events;

import io.github.eutro.sexp2es.api.EsCompiler;
import io.github.eutro.sexp2es.api.ProgramCompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired on the compiler when a program compilation is started, before anything else happens.
 * Listeners may attach their own listeners to the compilation.
 *
 * @see EsCompiler#lift()
 */
public class RunProgramCompilationEvent implements CompilerEvent {
    /**
     * The program compilation.
     */
    @NotNull
    public ProgramCompilation compilation;

    public RunProgramCompilationEvent(@NotNull ProgramCompilation compilation) {
        this.compilation = compilation;
    }
}
