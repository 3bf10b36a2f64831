package io.weave.core;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Barrier event synchronizing the latest events of several sources. Anything that
 * depends on a knot causally follows every event the knot synchronized.
 */
public record KnotEvent(EventId id, Instant timestamp, Set<EventId> synchronizedIds) implements Event<String> {

    public static final String CONTENT = "KNOT";
    public static final String SYSTEM_SOURCE = "system";

    public KnotEvent {
        Objects.requireNonNull(id);
        Objects.requireNonNull(timestamp);
        synchronizedIds = Set.copyOf(synchronizedIds);
    }

    /** Knot over {@code ids}; the id is derived from the set, so equal sets give equal ids. */
    public static KnotEvent over(Collection<EventId> ids, Instant timestamp) {
        return new KnotEvent(idFor(ids), timestamp, Set.copyOf(ids));
    }

    public static EventId idFor(Collection<EventId> ids) {
        var joined = new TreeSet<>(ids).stream().map(EventId::value).collect(Collectors.joining(","));
        return new EventId("knot-" + Determinism.sha256Hex(joined).substring(0, 16));
    }

    @Override public String content() { return CONTENT; }

    @Override public String source() { return SYSTEM_SOURCE; }
}
