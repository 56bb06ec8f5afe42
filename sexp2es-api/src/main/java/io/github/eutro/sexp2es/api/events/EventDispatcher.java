package io.github.eutro.sexp2es.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that fires compilation events, such as an {@link io.github.eutro.sexp2es.api.EsCompiler}
 * or a single {@link io.github.eutro.sexp2es.api.ProgramCompilation}.
 *
 * @param <E> The common supertype of the events fired.
 */
public interface EventDispatcher<E> {
    /**
     * Register a listener for one event class.
     * <p>
     * Events are matched on their exact class; a listener for a supertype does not see subtypes.
     *
     * @param type     The event class.
     * @param listener Called with each event of that class, in registration order.
     * @param <T>      The event class.
     */
    <T extends E> void listen(Class<T> type, @NotNull Consumer<T> listener);
}
