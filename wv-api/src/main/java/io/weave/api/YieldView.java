package io.weave.api;

import io.weave.governance.ApprovalResult;
import io.weave.governance.ApprovalStatus;
import io.weave.governance.YieldTurn;

import java.time.Instant;
import java.util.Set;

public record YieldView(
        String id,
        String source,
        Instant timestamp,
        Object content,
        String reason,
        String originalKind,
        Set<String> requiredApprovers,
        Set<String> approvedBy,
        Set<String> pendingApprovers,
        double confidence,
        double entropyCost,
        ApprovalStatus status,
        String rejectedBy,
        String detail
) {
    static YieldView pending(YieldTurn<?> t) {
        return of(t, ApprovalStatus.PENDING, null, null);
    }

    static YieldView resolved(ApprovalResult<?> r) {
        return of(r.turn(), r.status(), r.rejectedBy(), r.detail());
    }

    static YieldView of(YieldTurn<?> t, ApprovalStatus status, String rejectedBy, String detail) {
        return new YieldView(
                t.id().value(),
                t.source(),
                t.timestamp(),
                t.content(),
                t.reason(),
                t.originalKind().name(),
                t.requiredApprovers(),
                t.approvedBy(),
                t.pendingApprovers(),
                t.confidence(),
                t.entropyCost(),
                status,
                rejectedBy,
                detail
        );
    }
}
