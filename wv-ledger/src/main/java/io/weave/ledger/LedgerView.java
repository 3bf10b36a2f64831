package io.weave.ledger;

import io.weave.core.DependencyGraph;
import io.weave.core.Event;
import io.weave.core.EventId;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read side of a trace-monoid history: an observation-ordered event sequence plus
 * the dependency graph over the same ids.
 * <p>
 * Unknown ids never fail a read; they simply have no events, no dependencies and
 * are concurrent with everything.
 */
public abstract class LedgerView {

    protected abstract DependencyGraph graph();

    protected abstract List<Event<?>> eventList();

    protected abstract Event<?> lookup(EventId id);

    protected abstract List<EventId> idsOf(String source);

    protected abstract Set<String> sourceSet();

    /** Hook for implementations that must guard reads. */
    protected <R> R read(Supplier<R> query) { return query.get(); }

    public int size() { return read(() -> eventList().size()); }

    public boolean isEmpty() { return size() == 0; }

    /** All events in observation order. */
    public List<Event<?>> events() { return read(() -> List.copyOf(eventList())); }

    public Optional<Event<?>> get(EventId id) { return read(() -> Optional.ofNullable(lookup(id))); }

    public boolean contains(EventId id) { return read(() -> lookup(id) != null); }

    /** Sources in order of their first event. */
    public Set<String> sources() { return read(() -> Collections.unmodifiableSet(new LinkedHashSet<>(sourceSet()))); }

    /** Events appended by {@code source}, in append order. */
    public List<Event<?>> eventsOf(String source) {
        return read(() -> idsOf(source).stream().<Event<?>>map(this::lookup).toList());
    }

    /** Most recently appended event of {@code source}. */
    public Optional<Event<?>> latest(String source) {
        return read(() -> {
            var ids = idsOf(source);
            return ids.isEmpty() ? Optional.<Event<?>>empty() : Optional.<Event<?>>of(lookup(ids.get(ids.size() - 1)));
        });
    }

    public Set<EventId> dependencies(EventId id) { return read(() -> graph().getDependencies(id)); }

    public Set<EventId> allDependencies(EventId id) { return read(() -> graph().getAllDependencies(id)); }

    /** Direct-dependency map; with {@link #linearize()} enough to rebuild a span tree. */
    public Map<EventId, Set<EventId>> dependencyMap() { return read(() -> graph().edgeMap()); }

    public long generation() { return read(() -> graph().generation()); }

    public boolean areConcurrent(EventId a, EventId b) { return read(() -> graph().areConcurrent(a, b)); }

    public DependencyGraph.Order order(EventId a, EventId b) { return read(() -> graph().order(a, b)); }

    /** Events concurrent with {@code id}, in observation order. */
    public List<Event<?>> findConcurrent(EventId id) {
        return read(() -> eventList().stream()
                .filter(e -> !e.id().equals(id) && graph().areConcurrent(e.id(), id))
                .toList());
    }

    /** Every event in one valid causal order. Placeholder ids have no event and are skipped. */
    public List<Event<?>> linearize() { return read(() -> resolve(graph().topologicalSort())); }

    /** Valid causal order of {@code ids}, computed on the induced subgraph. */
    public List<Event<?>> linearizeSubset(Collection<EventId> ids) {
        return read(() -> resolve(graph().topologicalSort(ids)));
    }

    /** What {@code source} can see: its own events and everything they depend on. */
    public List<Event<?>> project(String source) {
        return read(() -> resolve(graph().topologicalSort(closureOf(idsOf(source)))));
    }

    /** {@code seeds} plus their transitive dependencies, restricted to real events. */
    public Set<EventId> causalClosure(Collection<EventId> seeds) { return read(() -> closureOf(seeds)); }

    private Set<EventId> closureOf(Collection<EventId> seeds) {
        var out = new LinkedHashSet<EventId>();
        for (var id : seeds) {
            if (lookup(id) != null) out.add(id);
            for (var dep : graph().getAllDependencies(id)) {
                if (lookup(dep) != null) out.add(dep);
            }
        }
        return out;
    }

    private List<Event<?>> resolve(List<EventId> ids) {
        return ids.stream().<Event<?>>map(this::lookup).filter(Objects::nonNull).toList();
    }
}
