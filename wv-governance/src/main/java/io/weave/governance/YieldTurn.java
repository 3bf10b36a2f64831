package io.weave.governance;

import io.weave.core.Determinism;
import io.weave.core.EventId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Proposed turn withheld until named approvers agree. Approving returns a new
 * value; {@code approvedBy} is always a subset of {@code requiredApprovers}.
 *
 * @param originalKind the kind of turn being gated, {@link TurnKind#ACTION} by default
 */
public record YieldTurn<T>(
        EventId id,
        T content,
        Instant timestamp,
        String source,
        String reason,
        Set<String> requiredApprovers,
        Set<String> approvedBy,
        TurnKind originalKind,
        String stateFingerprintPre,
        String stateFingerprintPost,
        double confidence,
        double entropyCost
) implements Turn<T> {
    public YieldTurn {
        Objects.requireNonNull(id);
        Objects.requireNonNull(timestamp);
        if (source == null || source.isBlank()) source = Determinism.node();
        if (reason == null) reason = "";
        requiredApprovers = frozen(requiredApprovers);
        approvedBy = frozen(approvedBy);
        for (var approver : approvedBy) {
            if (!requiredApprovers.contains(approver)) {
                throw new InvalidApproverException(id, approver, requiredApprovers);
            }
        }
        if (originalKind == null) originalKind = TurnKind.ACTION;
        if (originalKind == TurnKind.YIELD) throw new IllegalArgumentException("A yield cannot gate another yield");
        if (stateFingerprintPre == null) stateFingerprintPre = StateFingerprint.EMPTY;
        if (stateFingerprintPost == null) stateFingerprintPost = StateFingerprint.EMPTY;
        confidence = Turn.clampConfidence(confidence);
        entropyCost = Turn.clampEntropyCost(entropyCost);
    }

    private static Set<String> frozen(Set<String> names) {
        if (names == null || names.isEmpty()) return Set.of();
        var copy = new LinkedHashSet<String>();
        for (var n : names) copy.add(Objects.requireNonNull(n, "approver"));
        return Collections.unmodifiableSet(copy);
    }

    public static <T> YieldTurn<T> create(T content, String source, String reason,
                                          Set<String> requiredApprovers, TurnKind originalKind,
                                          Object statePre, Object statePost,
                                          double confidence, double entropyCost) {
        return new YieldTurn<>(EventId.random(), content, Determinism.now(), source, reason,
                requiredApprovers, Set.of(), originalKind,
                StateFingerprint.of(statePre), StateFingerprint.of(statePost), confidence, entropyCost);
    }

    public static <T> YieldTurn<T> create(T content, String source, String reason, Set<String> requiredApprovers) {
        return create(content, source, reason, requiredApprovers, TurnKind.ACTION, null, null, 1.0, 0.0);
    }

    @Override public TurnKind kind() { return TurnKind.YIELD; }

    /**
     * Copy with {@code approver} added to {@code approvedBy}.
     *
     * @throws InvalidApproverException if {@code approver} is not required
     */
    public YieldTurn<T> approve(String approver) {
        if (approver == null || !requiredApprovers.contains(approver)) {
            throw new InvalidApproverException(id, approver, requiredApprovers);
        }
        if (approvedBy.contains(approver)) return this;
        var grown = new LinkedHashSet<>(approvedBy);
        grown.add(approver);
        return new YieldTurn<>(id, content, timestamp, source, reason, requiredApprovers, grown, originalKind,
                stateFingerprintPre, stateFingerprintPost, confidence, entropyCost);
    }

    /** Every required approver has approved. */
    public boolean isApproved() { return approvedBy.containsAll(requiredApprovers); }

    public Set<String> pendingApprovers() {
        var left = new LinkedHashSet<>(requiredApprovers);
        left.removeAll(approvedBy);
        return Collections.unmodifiableSet(left);
    }
}
