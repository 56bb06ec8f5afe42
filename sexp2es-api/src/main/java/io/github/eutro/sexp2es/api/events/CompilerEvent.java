package io.github.eutro.sexp2es.api.events;

import io.github.eutro.sexp2es.api.EsCompiler;

/**
 * An event fired on an {@link EsCompiler}.
 */
public interface CompilerEvent {
}
