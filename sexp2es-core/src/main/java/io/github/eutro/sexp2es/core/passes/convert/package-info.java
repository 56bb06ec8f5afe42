/**
 * Passes that convert between forms of a program.
 * <p>
 * {@link io.github.eutro.sexp2es.core.passes.convert.IrToEs} lowers analyzed IR to ESTree.
 */
package io.github.eutro.sexp2es.core.passes.convert;
