package io.weave.governance;

/**
 * When enough approvers have agreed. A yield with no required approvers satisfies
 * every strategy. Rejection is a veto under all of them.
 */
public enum ApprovalStrategy {
    /** Every required approver. */
    ALL,
    /** The first approval. */
    ANY,
    /** Strictly more than half of the required approvers. */
    MAJORITY;

    public boolean isSatisfied(YieldTurn<?> turn) {
        int required = turn.requiredApprovers().size();
        if (required == 0) return true;
        int approved = turn.approvedBy().size();
        return switch (this) {
            case ALL -> turn.isApproved();
            case ANY -> approved > 0;
            case MAJORITY -> approved * 2 > required;
        };
    }
}
