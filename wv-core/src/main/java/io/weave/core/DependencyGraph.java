package io.weave.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directed acyclic graph over event ids. An edge {@code a -> b} means {@code a}
 * depends on {@code b}, so {@code b} causally precedes {@code a}.
 * <p>
 * The graph only grows. Inserts that would close a cycle are rejected before
 * anything is touched. Dependencies on ids that were never inserted create empty
 * placeholder nodes, so producers may declare edges out of order.
 * <p>
 * Not safe for concurrent mutation. Reads may run concurrently with each other.
 */
public final class DependencyGraph {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    /** Causal relation of a left id to a right id. */
    public enum Order { BEFORE, AFTER, EQUAL, CONCURRENT }

    private final Map<EventId, Set<EventId>> edges = new LinkedHashMap<>();
    private final Map<EventId, Set<EventId>> dependents = new HashMap<>();
    private final Map<EventId, Integer> rank = new HashMap<>();
    private long generation;
    private volatile Closures closures = new Closures(0);

    /** Transitive closures valid for a single structural generation. */
    private static final class Closures {
        final long generation;
        final Map<EventId, Set<EventId>> byId = new ConcurrentHashMap<>();

        Closures(long generation) { this.generation = generation; }
    }

    public DependencyGraph() {}

    private DependencyGraph(DependencyGraph other) {
        other.edges.forEach((k, v) -> edges.put(k, new LinkedHashSet<>(v)));
        other.dependents.forEach((k, v) -> dependents.put(k, new LinkedHashSet<>(v)));
        rank.putAll(other.rank);
        generation = other.generation;
        closures = new Closures(generation);
    }

    /* ---------- Mutation ---------- */

    /**
     * Insert {@code id} depending on {@code dependsOn}. Re-inserting a known id (for
     * instance a placeholder) adds the new edges to the existing ones.
     *
     * @throws CycleException if {@code id} is among its own dependencies or one of
     *                        them already (transitively) depends on {@code id}
     */
    public void addNode(EventId id, Collection<EventId> dependsOn) {
        Objects.requireNonNull(id, "id");
        var deps = new LinkedHashSet<EventId>(dependsOn == null ? List.of() : dependsOn);
        deps.forEach(d -> Objects.requireNonNull(d, "dependency"));

        if (deps.contains(id)) {
            log.warn("Rejected self-dependency of {}", id);
            throw new CycleException(id, deps, "Event " + id + " cannot depend on itself");
        }
        if (edges.containsKey(id)) {
            for (var d : deps) {
                if (edges.containsKey(d) && getAllDependencies(d).contains(id)) {
                    log.warn("Rejected {} -> {}: {} already depends on {}", id, d, d, id);
                    throw new CycleException(id, deps,
                            "Adding " + id + " -> " + d + " would create a cycle");
                }
            }
        }

        materialize(id);
        for (var d : deps) {
            materialize(d);
            edges.get(id).add(d);
            dependents.get(d).add(id);
        }
        generation++;
    }

    private void materialize(EventId id) {
        if (edges.containsKey(id)) return;
        edges.put(id, new LinkedHashSet<>());
        dependents.put(id, new LinkedHashSet<>());
        rank.put(id, rank.size());
    }

    /* ---------- Queries ---------- */

    public boolean contains(EventId id) { return edges.containsKey(id); }

    public int size() { return edges.size(); }

    /** Bumped on every structural change. */
    public long generation() { return generation; }

    /** All node ids in insertion order (placeholders included). */
    public List<EventId> nodes() { return List.copyOf(edges.keySet()); }

    /** Direct dependencies; empty for unknown ids. */
    public Set<EventId> getDependencies(EventId id) {
        var deps = edges.get(id);
        return deps == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(deps));
    }

    /** Direct dependents; empty for unknown ids. */
    public Set<EventId> getDependents(EventId id) {
        var deps = dependents.get(id);
        return deps == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(deps));
    }

    /** Everything {@code id} transitively depends on; empty for unknown ids. */
    public Set<EventId> getAllDependencies(EventId id) {
        if (!edges.containsKey(id)) return Set.of();
        var c = closures;
        if (c.generation != generation) {
            c = new Closures(generation);
            closures = c;
        }
        return closure(id, c.byId);
    }

    private Set<EventId> closure(EventId id, Map<EventId, Set<EventId>> memo) {
        var done = memo.get(id);
        if (done != null) return done;
        // breadth-first over the DAG, reusing closures already cached this generation
        var all = new HashSet<EventId>();
        var queue = new ArrayDeque<>(edges.get(id));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (!all.add(next)) continue;
            var cached = memo.get(next);
            if (cached != null) {
                all.addAll(cached);
            } else {
                queue.addAll(edges.get(next));
            }
        }
        var result = Collections.unmodifiableSet(all);
        memo.put(id, result);
        return result;
    }

    /** Classify {@code a} relative to {@code b}. Unknown ids are concurrent with everything. */
    public Order order(EventId a, EventId b) {
        if (!contains(a) || !contains(b)) return Order.CONCURRENT;
        if (a.equals(b)) return Order.EQUAL;
        if (getAllDependencies(b).contains(a)) return Order.BEFORE;
        if (getAllDependencies(a).contains(b)) return Order.AFTER;
        return Order.CONCURRENT;
    }

    /** True iff neither id reaches the other. */
    public boolean areConcurrent(EventId a, EventId b) { return order(a, b) == Order.CONCURRENT; }

    /** Strict happens-before: {@code b} transitively depends on {@code a}. */
    public boolean happensBefore(EventId a, EventId b) { return order(a, b) == Order.BEFORE; }

    /** Nodes without dependencies, in insertion order. */
    public List<EventId> getRoots() {
        return edges.entrySet().stream().filter(e -> e.getValue().isEmpty()).map(Map.Entry::getKey).toList();
    }

    /** Nodes nothing depends on, in insertion order. */
    public List<EventId> getLeaves() {
        return edges.keySet().stream().filter(id -> dependents.get(id).isEmpty()).toList();
    }

    /* ---------- Ordering ---------- */

    /**
     * One valid total order (dependencies first) via Kahn's algorithm. Among ready
     * nodes the earliest inserted goes first.
     *
     * @throws CycleException if not every node can be emitted
     */
    public List<EventId> topologicalSort() { return kahn(edges.keySet()); }

    /**
     * Valid order of the subgraph induced by {@code subset}; edges leaving the subset
     * are ignored and ids outside the graph are dropped.
     */
    public List<EventId> topologicalSort(Collection<EventId> subset) {
        var nodes = new LinkedHashSet<EventId>();
        for (var id : subset) if (edges.containsKey(id)) nodes.add(id);
        return kahn(nodes);
    }

    private List<EventId> kahn(Set<EventId> nodes) {
        var remaining = new HashMap<EventId, Integer>();
        var ready = new PriorityQueue<EventId>(Comparator.comparingInt(rank::get));
        for (var id : nodes) {
            int n = 0;
            for (var d : edges.get(id)) if (nodes.contains(d)) n++;
            remaining.put(id, n);
            if (n == 0) ready.add(id);
        }
        var out = new ArrayList<EventId>(nodes.size());
        while (!ready.isEmpty()) {
            var id = ready.poll();
            out.add(id);
            for (var dependent : dependents.get(id)) {
                var left = remaining.get(dependent);
                if (left == null) continue;
                remaining.put(dependent, left - 1);
                if (left == 1) ready.add(dependent);
            }
        }
        if (out.size() != nodes.size()) {
            throw new CycleException(null, Set.of(), "Graph contains a cycle; sorted "
                    + out.size() + " of " + nodes.size() + " nodes");
        }
        return out;
    }

    /* ---------- Snapshots ---------- */

    /** Independent copy; later changes to either graph do not affect the other. */
    public DependencyGraph copy() { return new DependencyGraph(this); }

    /** Direct-dependency map in insertion order. */
    public Map<EventId, Set<EventId>> edgeMap() {
        var out = new LinkedHashMap<EventId, Set<EventId>>();
        edges.forEach((k, v) -> out.put(k, Set.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }

    @Override public String toString() {
        return "DependencyGraph{nodes=" + edges.size() + ", generation=" + generation + "}";
    }
}
