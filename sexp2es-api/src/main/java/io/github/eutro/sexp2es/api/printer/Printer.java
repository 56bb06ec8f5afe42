package io.github.eutro.sexp2es.api.printer;

import io.github.eutro.sexp2es.core.estree.Program;

/**
 * Renders a lowered program as source text.
 * <p>
 * No printer is bundled, hosts supply one, for example by handing the
 * program to escodegen.
 */
@FunctionalInterface
public interface Printer {
    /**
     * Render a program.
     *
     * @param program The program.
     * @param options The options to render with.
     * @return The source text.
     */
    String print(Program program, PrinterOptions options);
}
