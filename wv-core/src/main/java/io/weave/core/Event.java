package io.weave.core;

import java.time.Instant;

/**
 * Immutable record of something an agent did. The content is never inspected by
 * the ledger; ordering between events comes only from declared dependencies.
 *
 * @param <T> payload type
 */
public interface Event<T> {

    EventId id();

    T content();

    /** Observation time. Ties are broken by ledger insertion order. */
    Instant timestamp();

    /** Producing agent. */
    String source();

    /** Event with a fresh id, stamped by {@link Determinism}. */
    static <T> Event<T> of(T content, String source) {
        return new SimpleEvent<>(EventId.random(), content, Determinism.now(), source);
    }
}
