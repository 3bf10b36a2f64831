package io.weave.ledger;

import io.weave.core.CycleException;
import io.weave.core.DependencyGraph;
import io.weave.core.Determinism;
import io.weave.core.Event;
import io.weave.core.EventId;
import io.weave.core.KnotEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Append-only event history with explicit causal dependencies (a trace monoid).
 * <p>
 * Appends and joins are serialized by a write lock; reads share a read lock and
 * may run concurrently with each other. Every appended event is also published to
 * {@link #subscribe() subscribers}.
 */
public final class Ledger extends LedgerView implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private final DependencyGraph graph = new DependencyGraph();
    private final List<Event<?>> events = new ArrayList<>();
    private final Map<EventId, Event<?>> byId = new HashMap<>();
    private final Map<String, List<EventId>> bySource = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final SubmissionPublisher<Event<?>> bus = new SubmissionPublisher<>();

    /**
     * Record {@code event} after everything in {@code dependsOn}.
     *
     * @throws CycleException           if the dependencies would close a cycle; nothing is recorded
     * @throws IllegalArgumentException if an event with the same id was already appended
     */
    public EventId append(Event<?> event, Collection<EventId> dependsOn) {
        Objects.requireNonNull(event, "event");
        var w = lock.writeLock();
        w.lock();
        try {
            if (byId.containsKey(event.id())) {
                throw new IllegalArgumentException("Event " + event.id() + " already recorded");
            }
            graph.addNode(event.id(), dependsOn);
            events.add(event);
            byId.put(event.id(), event);
            bySource.computeIfAbsent(event.source(), k -> new ArrayList<>()).add(event.id());
            log.debug("Appended {} from {} depending on {}", event.id(), event.source(), dependsOn);
            if (!bus.isClosed()) {
                bus.offer(event, (subscriber, dropped) -> {
                    log.warn("Subscriber {} lagging; dropped event {}", subscriber, dropped.id());
                    return false;
                });
            }
            return event.id();
        } finally {
            w.unlock();
        }
    }

    /** Convenience: wrap {@code content} in a fresh event and append it. */
    public <T> Event<T> append(T content, String source, Collection<EventId> dependsOn) {
        var event = Event.of(content, source);
        append(event, dependsOn);
        return event;
    }

    /** Append without dependencies. */
    public EventId append(Event<?> event) { return append(event, List.of()); }

    /**
     * Synchronize {@code sources}: append a knot depending on each source's latest
     * event. Sources without events are left out. Joining an unchanged set of tips
     * returns the knot already recorded for it.
     */
    public KnotEvent join(Collection<String> sources) {
        var w = lock.writeLock();
        w.lock();
        try {
            var tips = new ArrayList<EventId>();
            Instant stamp = null;
            for (var source : new LinkedHashSet<>(sources)) {
                var ids = bySource.get(source);
                if (ids == null || ids.isEmpty()) continue;
                var tip = byId.get(ids.get(ids.size() - 1));
                tips.add(tip.id());
                if (stamp == null || tip.timestamp().isAfter(stamp)) stamp = tip.timestamp();
            }
            var knotId = KnotEvent.idFor(tips);
            var existing = byId.get(knotId);
            if (existing instanceof KnotEvent k) {
                log.debug("Join over {} already knotted as {}", sources, knotId);
                return k;
            }
            var knot = KnotEvent.over(tips, stamp == null ? Determinism.now() : stamp);
            append(knot, tips);
            log.debug("Joined {} at {}", sources, knot.id());
            return knot;
        } finally {
            w.unlock();
        }
    }

    /** Frozen copy of the current history. */
    public LedgerSnapshot snapshot() {
        return read(() -> {
            var sources = new LinkedHashMap<String, List<EventId>>();
            bySource.forEach((k, v) -> sources.put(k, List.copyOf(v)));
            return new LedgerSnapshot(graph.copy(), events, byId, Collections.unmodifiableMap(sources));
        });
    }

    /** Stream of appended events, knots included. */
    public Flow.Publisher<Event<?>> subscribe() { return bus; }

    /** Completes all subscribers. */
    @Override
    public void close() { bus.close(); }

    @Override
    protected <R> R read(Supplier<R> query) {
        var r = lock.readLock();
        r.lock();
        try {
            return query.get();
        } finally {
            r.unlock();
        }
    }

    @Override protected DependencyGraph graph() { return graph; }

    @Override protected List<Event<?>> eventList() { return events; }

    @Override protected Event<?> lookup(EventId id) { return id == null ? null : byId.get(id); }

    @Override protected List<EventId> idsOf(String source) { return bySource.getOrDefault(source, List.of()); }

    @Override protected Set<String> sourceSet() { return bySource.keySet(); }
}
