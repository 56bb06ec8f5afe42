package io.github.eutro.sexp2es.core.passes;

import io.github.eutro.sexp2es.core.passes.misc.ChainedPass;

/**
 * A pass to run on some form of a program (analyzed IR forms, an ESTree {@link io.github.eutro.sexp2es.core.estree.Program}),
 * converting it to the next form in the pipeline.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 * @see io.github.eutro.sexp2es.core.passes.convert.IrToEs
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The program to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @return The composed pass.
     * @param <C> The result type.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
