/**
 * A configurable API over the lower-level core sexp2es API.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.sexp2es.api.EsCompiler},
 * to which analyzed forms can be submitted for compilation.
 * <p>
 * The compiler can be configured using the {@link io.github.eutro.sexp2es.api.events
 * events API}.
 */
package io.github.eutro.sexp2es.api;
