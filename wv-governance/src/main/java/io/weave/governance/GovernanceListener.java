package io.weave.governance;

/**
 * Observer of approval requests. Exceptions thrown here are logged and never
 * affect how a request resolves.
 */
public interface GovernanceListener {

    default void onRequested(YieldTurn<?> turn) {}

    /** Fired once per request, when it resolves approved. */
    default void onApproval(YieldTurn<?> turn) {}

    default void onRejection(YieldTurn<?> turn, String rejector, String reason) {}

    default void onTimeout(YieldTurn<?> turn) {}
}
