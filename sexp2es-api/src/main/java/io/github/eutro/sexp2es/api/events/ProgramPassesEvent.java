package io.github.eutro.sexp2es.api.events;

import io.github.eutro.sexp2es.api.ProgramCompilation;
import io.github.eutro.sexp2es.core.estree.Program;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired just after the forms are lowered to a {@link Program}.
 * <p>
 * Listeners may rewrite the program in place, or replace it entirely.
 *
 * @see ProgramCompilation
 */
public class ProgramPassesEvent implements ProgramCompileEvent {
    /**
     * The lowered program.
     */
    @NotNull
    public Program program;

    public ProgramPassesEvent(@NotNull Program program) {
        this.program = program;
    }
}
