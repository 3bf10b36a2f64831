package io.weave.ledger;

import io.weave.core.DependencyGraph;
import io.weave.core.Event;
import io.weave.core.EventId;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Frozen copy of a {@link Ledger}; later appends do not show through. */
public final class LedgerSnapshot extends LedgerView {
    private final DependencyGraph graph;
    private final List<Event<?>> events;
    private final Map<EventId, Event<?>> byId;
    private final Map<String, List<EventId>> bySource;

    LedgerSnapshot(DependencyGraph graph, List<Event<?>> events,
                   Map<EventId, Event<?>> byId, Map<String, List<EventId>> bySource) {
        this.graph = graph;
        this.events = List.copyOf(events);
        this.byId = Map.copyOf(byId);
        this.bySource = bySource;
    }

    @Override protected DependencyGraph graph() { return graph; }

    @Override protected List<Event<?>> eventList() { return events; }

    @Override protected Event<?> lookup(EventId id) { return id == null ? null : byId.get(id); }

    @Override protected List<EventId> idsOf(String source) { return bySource.getOrDefault(source, List.of()); }

    @Override protected Set<String> sourceSet() { return bySource.keySet(); }
}
