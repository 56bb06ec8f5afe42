package io.github.eutro.sexp2es.api.bits;

/**
 * A reusable piece of compiler behaviour, usually a set of event listeners,
 * that is installed with {@code add(bit)} on a compiler or a compilation.
 *
 * @param <Target> What the behaviour is installed on.
 * @param <R>      A handle returned to the caller, such as an output queue.
 */
@FunctionalInterface
public interface Bit<Target, R> {
    /**
     * Install this behaviour.
     *
     * @param target The compiler or compilation.
     * @return The handle.
     */
    R attachTo(Target target);
}
