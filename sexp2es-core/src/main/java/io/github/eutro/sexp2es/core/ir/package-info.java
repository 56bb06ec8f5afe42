/**
 * The analyzed Lisp IR consumed by {@link io.github.eutro.sexp2es.core.passes.convert.IrToEs}.
 * <p>
 * Nodes are plain public-field classes; use {@link io.github.eutro.sexp2es.core.ir.Forms}
 * to build them by hand.
 */
package io.github.eutro.sexp2es.core.ir;
