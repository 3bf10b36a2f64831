package io.weave.core;

import java.time.Instant;
import java.util.Objects;

public record SimpleEvent<T>(
        EventId id,
        T content,
        Instant timestamp,
        String source
) implements Event<T> {
    public SimpleEvent {
        Objects.requireNonNull(id);
        Objects.requireNonNull(timestamp);
        if (source == null || source.isBlank()) source = Determinism.node();
    }
}
