package io.weave.governance;

import io.weave.core.Determinism;
import io.weave.core.EventId;

import java.time.Instant;
import java.util.Objects;

/** Any turn that is not a yield. */
public record StandardTurn<T>(
        EventId id,
        T content,
        Instant timestamp,
        String source,
        TurnKind kind,
        String stateFingerprintPre,
        String stateFingerprintPost,
        double confidence,
        double entropyCost
) implements Turn<T> {
    public StandardTurn {
        Objects.requireNonNull(id);
        Objects.requireNonNull(timestamp);
        Objects.requireNonNull(kind);
        if (kind == TurnKind.YIELD) throw new IllegalArgumentException("Yields are built as YieldTurn");
        if (source == null || source.isBlank()) source = Determinism.node();
        if (stateFingerprintPre == null) stateFingerprintPre = StateFingerprint.EMPTY;
        if (stateFingerprintPost == null) stateFingerprintPost = StateFingerprint.EMPTY;
        confidence = Turn.clampConfidence(confidence);
        entropyCost = Turn.clampEntropyCost(entropyCost);
    }

    /** Fresh turn; snapshots are fingerprinted, not stored. */
    public static <T> StandardTurn<T> create(TurnKind kind, T content, String source,
                                             Object statePre, Object statePost,
                                             double confidence, double entropyCost) {
        return new StandardTurn<>(EventId.random(), content, Determinism.now(), source, kind,
                StateFingerprint.of(statePre), StateFingerprint.of(statePost), confidence, entropyCost);
    }

    public static <T> StandardTurn<T> create(TurnKind kind, T content, String source) {
        return create(kind, content, source, null, null, 1.0, 0.0);
    }
}
