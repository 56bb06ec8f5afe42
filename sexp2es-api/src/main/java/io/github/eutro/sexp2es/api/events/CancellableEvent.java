package io.github.eutro.sexp2es.api.events;

/**
 * An event that can be cancelled, preventing later listeners from receiving it.
 */
public interface CancellableEvent {
    boolean isCancelled();

    /**
     * Cancel the event.
     */
    void cancel();
}
