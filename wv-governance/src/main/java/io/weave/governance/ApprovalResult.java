package io.weave.governance;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of an approval request.
 *
 * @param turn       the yield as it stood at resolution, with every approval folded in
 * @param rejectedBy set only for {@link ApprovalStatus#REJECTED}
 * @param detail     rejection reason or timeout description, empty when approved
 * @param waited     time spent suspended
 */
public record ApprovalResult<T>(
        ApprovalStatus status,
        YieldTurn<T> turn,
        String rejectedBy,
        String detail,
        Duration waited
) {
    public ApprovalResult {
        Objects.requireNonNull(status);
        Objects.requireNonNull(turn);
        if (!status.isTerminal()) throw new IllegalArgumentException("Result must be terminal: " + status);
        if (detail == null) detail = "";
        if (waited == null) waited = Duration.ZERO;
    }

    public boolean isApproved() { return status == ApprovalStatus.APPROVED; }
}
