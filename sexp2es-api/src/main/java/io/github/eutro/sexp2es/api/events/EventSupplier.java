package io.github.eutro.sexp2es.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A class on which events can be listened to and dispatched.
 * <p>
 * Listeners run in the order they were added. A listener added twice runs twice.
 *
 * @param <S> The type of events that can be listened to or dispatched.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>()).add(listener);
    }

    /**
     * Dispatch an event to listeners, stopping early if it is {@link CancellableEvent cancelled}.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        @SuppressWarnings("unchecked")
        List<Consumer<T>> eventListeners = (List<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptyList());
        for (Consumer<T> consumer : eventListeners) {
            if (event instanceof CancellableEvent
                    && ((CancellableEvent) event).isCancelled()) {
                break;
            }
            consumer.accept(event);
        }
        return event;
    }
}
