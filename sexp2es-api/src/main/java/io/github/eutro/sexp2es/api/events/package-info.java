/**
 * Events that occur during a compilation.
 * <p>
 * These can be used to configure the compiler, to install extra
 * special forms, to rewrite the lowered program, and the like.
 * <p>
 * The API revolves around {@link io.github.eutro.sexp2es.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.sexp2es.api.events;
