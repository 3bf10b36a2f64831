package io.weave.governance;

import io.weave.core.Event;

/**
 * Governed unit of agent behavior: an event tagged with a {@link TurnKind} and the
 * metadata approval policies look at.
 * <p>
 * Yields are the only kind with extra payload and have their own variant.
 */
public sealed interface Turn<T> extends Event<T> permits StandardTurn, YieldTurn {

    TurnKind kind();

    /** Fingerprint of the state before the turn, or {@link StateFingerprint#EMPTY}. */
    String stateFingerprintPre();

    /** Fingerprint of the state after the turn, or {@link StateFingerprint#EMPTY}. */
    String stateFingerprintPost();

    /** In [0, 1]. */
    double confidence();

    /** In [0, inf). */
    double entropyCost();

    default boolean isObservable() { return kind().isObservable(); }

    default boolean isBlocking() { return kind().isBlocking(); }

    default boolean isEffectful() { return kind().isEffectful(); }

    default boolean requiresGovernance() { return kind().requiresGovernance(); }

    static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) return 0.0;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    static double clampEntropyCost(double entropyCost) {
        if (Double.isNaN(entropyCost)) return 0.0;
        return Math.max(0.0, entropyCost);
    }
}
