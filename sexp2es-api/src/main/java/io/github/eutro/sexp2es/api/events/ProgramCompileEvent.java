package io.github.eutro.sexp2es.api.events;

import io.github.eutro.sexp2es.api.ProgramCompilation;

/**
 * An event fired during the compilation of a single program.
 *
 * @see ProgramCompilation
 */
public interface ProgramCompileEvent {
}
