package io.weave.ledger;

import io.weave.core.Event;
import io.weave.core.EventId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Minimal causal context for an agent: its own events plus everything they
 * transitively depend on, in a valid causal order.
 * <p>
 * Works on a snapshot of the ledger taken at construction or on the last
 * {@link #refresh()}. Later appends are invisible until refreshed, so a decision
 * cycle sees a stable view.
 */
public final class CausalCone {
    private static final Logger log = LoggerFactory.getLogger(CausalCone.class);

    private final Ledger ledger;
    private volatile LedgerSnapshot view;

    public CausalCone(Ledger ledger) {
        this.ledger = Objects.requireNonNull(ledger);
        this.view = ledger.snapshot();
    }

    /** Re-read the ledger. */
    public CausalCone refresh() {
        view = ledger.snapshot();
        log.debug("Cone refreshed at generation {} ({} events)", view.generation(), view.size());
        return this;
    }

    /** True when the ledger changed since the last refresh. */
    public boolean isStale() { return view.generation() != ledger.generation(); }

    public LedgerSnapshot view() { return view; }

    /** Context {@code source} needs before acting; empty if it has no events. */
    public List<Event<?>> projectContext(String source) { return contextOf(view, source); }

    private static List<Event<?>> contextOf(LedgerSnapshot v, String source) {
        return v.linearizeSubset(v.causalClosure(v.eventsOf(source).stream().map(Event::id).toList()));
    }

    /** Same projection seeded from arbitrary event ids. Unknown ids contribute nothing. */
    public List<Event<?>> projectContextFromEvents(Collection<EventId> ids) {
        var v = view;
        return v.linearizeSubset(v.causalClosure(ids));
    }

    /** Negation of concurrency: one of the two reaches the other. */
    public boolean areCausallyRelated(EventId a, EventId b) { return !view.areConcurrent(a, b); }

    public int coneSize(String source) { return projectContext(source).size(); }

    /**
     * Share of history {@code source} does not need: {@code 1 - coneSize / totalEvents}.
     * 0 for an empty ledger.
     */
    public double compressionRatio(String source) {
        var v = view;
        int total = v.size();
        if (total == 0) return 0.0;
        return 1.0 - (double) contextOf(v, source).size() / total;
    }
}
