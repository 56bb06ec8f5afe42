package io.github.eutro.sexp2es.api.events;

import io.github.eutro.sexp2es.api.ProgramCompilation;
import io.github.eutro.sexp2es.api.printer.PrinterOptions;
import io.github.eutro.sexp2es.core.estree.Program;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a program should be emitted.
 *
 * @see ProgramCompilation
 */
public class EmitProgramEvent implements ProgramCompileEvent, CancellableEvent {
    /**
     * The program to be emitted.
     */
    @NotNull
    public Program program;
    /**
     * The options to print the program with.
     */
    @NotNull
    public PrinterOptions options;
    private boolean cancelled = false;

    /**
     * Construct a new program emit event.
     *
     * @param program The program to emit.
     * @param options The printer options.
     */
    public EmitProgramEvent(@NotNull Program program, @NotNull PrinterOptions options) {
        this.program = program;
        this.options = options;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
