package io.weave.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/** Opaque event handle. */
public record EventId(String value) implements Comparable<EventId> {
    public EventId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("blank event id");
    }

    /** Fresh id from the current {@link Determinism} RNG. */
    public static EventId random() { return new EventId(Determinism.randomUUID().toString()); }

    @JsonCreator public static EventId of(String value) { return new EventId(value); }

    @Override public int compareTo(EventId o) { return value.compareTo(o.value); }

    @JsonValue public String json() { return value; }
    @Override public String toString() { return value; }
}
