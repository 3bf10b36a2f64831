package io.weave.governance;

import io.weave.core.Event;
import io.weave.core.EventId;
import io.weave.core.KnotEvent;
import io.weave.ledger.CausalCone;
import io.weave.ledger.Ledger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for agents: records events and turns in one {@link Ledger}, routes
 * yields through one {@link YieldHandler}, and builds causal cones for context.
 */
public final class Weave implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Weave.class);

    private final Ledger ledger;
    private final YieldHandler yieldHandler;

    public Weave() {
        this(new Ledger(), new YieldHandler());
    }

    public Weave(Ledger ledger, YieldHandler yieldHandler) {
        this.ledger = Objects.requireNonNull(ledger);
        this.yieldHandler = Objects.requireNonNull(yieldHandler);
    }

    public Ledger ledger() { return ledger; }

    public YieldHandler yieldHandler() { return yieldHandler; }

    public int size() { return ledger.size(); }

    /* ---------- Producers ---------- */

    public <T> Event<T> record(T content, String source, Collection<EventId> dependsOn) {
        return ledger.append(content, source, dependsOn);
    }

    public <T> StandardTurn<T> recordTurn(TurnKind kind, T content, String source, Collection<EventId> dependsOn,
                                          Object statePre, Object statePost,
                                          double confidence, double entropyCost) {
        var turn = StandardTurn.create(kind, content, source, statePre, statePost, confidence, entropyCost);
        ledger.append(turn, dependsOn);
        return turn;
    }

    public <T> StandardTurn<T> recordTurn(TurnKind kind, T content, String source, Collection<EventId> dependsOn) {
        return recordTurn(kind, content, source, dependsOn, null, null, 1.0, 0.0);
    }

    /**
     * Record a yield in the ledger. It is not awaited yet; pass it to
     * {@link #awaitApproval} or {@link #requestApprovalAsync}.
     */
    public <T> YieldTurn<T> submitYield(T content, String source, String reason, Set<String> requiredApprovers,
                                        Collection<EventId> dependsOn, TurnKind originalKind,
                                        Object statePre, Object statePost,
                                        double confidence, double entropyCost) {
        var turn = YieldTurn.create(content, source, reason, requiredApprovers, originalKind,
                statePre, statePost, confidence, entropyCost);
        ledger.append(turn, dependsOn);
        log.debug("Yield {} submitted by {}: {}", turn.id(), source, reason);
        return turn;
    }

    public <T> YieldTurn<T> submitYield(T content, String source, String reason, Set<String> requiredApprovers,
                                        Collection<EventId> dependsOn) {
        return submitYield(content, source, reason, requiredApprovers, dependsOn, TurnKind.ACTION,
                null, null, 1.0, 0.0);
    }

    public <T> ApprovalResult<T> awaitApproval(YieldTurn<T> turn, Duration timeout, ApprovalStrategy strategy) {
        return yieldHandler.requestApproval(turn, timeout, strategy);
    }

    /** Record a yield and block until it resolves. */
    public <T> ApprovalResult<T> submitAndAwait(T content, String source, String reason, Set<String> requiredApprovers,
                                                Collection<EventId> dependsOn, Duration timeout,
                                                ApprovalStrategy strategy) {
        return awaitApproval(submitYield(content, source, reason, requiredApprovers, dependsOn), timeout, strategy);
    }

    public <T> CompletableFuture<ApprovalResult<T>> requestApprovalAsync(YieldTurn<T> turn, Duration timeout,
                                                                         ApprovalStrategy strategy) {
        return yieldHandler.requestApprovalAsync(turn, timeout, strategy);
    }

    /** Synchronize sources behind a knot later events can depend on. */
    public KnotEvent join(Collection<String> sources) { return ledger.join(sources); }

    /* ---------- Context ---------- */

    /** Cone over the ledger as it stands now. */
    public CausalCone cone() { return new CausalCone(ledger); }

    public List<Event<?>> context(String source) { return cone().projectContext(source); }

    public WeaveMetrics metrics() {
        var snapshot = ledger.snapshot();
        var byKind = new EnumMap<TurnKind, Integer>(TurnKind.class);
        var bySource = new LinkedHashMap<String, Integer>();
        for (var event : snapshot.events()) {
            bySource.merge(event.source(), 1, Integer::sum);
            if (event instanceof Turn<?> turn) byKind.merge(turn.kind(), 1, Integer::sum);
        }
        var cone = cone();
        var coneStats = new LinkedHashMap<String, Double>();
        for (var source : snapshot.sources()) {
            if (KnotEvent.SYSTEM_SOURCE.equals(source)) continue;
            coneStats.put(source, cone.compressionRatio(source));
        }
        double average = coneStats.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new WeaveMetrics(snapshot.size(), byKind, bySource, yieldHandler.pendingCount(), average, coneStats);
    }

    @Override
    public void close() {
        yieldHandler.close();
        ledger.close();
    }
}
