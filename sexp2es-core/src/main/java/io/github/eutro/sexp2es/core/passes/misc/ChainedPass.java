package io.github.eutro.sexp2es.core.passes.misc;

import io.github.eutro.sexp2es.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 * <p>
 * If any pass in a chain fails, the exception is rethrown with a suppressed
 * exception naming the position of the failing pass in the flattened chain.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    /**
     * Flatten this chain, so nested chains don't nest their error reporting.
     *
     * @return Every pass in this chain, in the order they run.
     */
    @SuppressWarnings("unchecked")
    public List<IRPass<Object, Object>> passes() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
            passes.add(chained.nextPass);
            pass = chained.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<IRPass<Object, Object>>) (Object) passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<Object, Object>> passes = passes();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                acc = passes.get(i).run(acc);
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw t;
            }
        }
        return (C) acc;
    }
}
