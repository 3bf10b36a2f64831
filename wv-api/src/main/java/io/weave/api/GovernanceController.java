package io.weave.api;

import io.weave.core.EventId;
import io.weave.governance.ApprovalStatus;
import io.weave.governance.ApprovalStrategy;
import io.weave.governance.TurnKind;
import io.weave.governance.Weave;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Yields for producers, approvers and governance UIs. */
@RestController
@RequestMapping("/api/yields")
public class GovernanceController {
    private static final Logger log = LoggerFactory.getLogger(GovernanceController.class);

    private final Weave weave;
    private final WeaveProperties props;
    /** Last known view per submitted yield; seeded PENDING at submit so lookups never miss it. */
    private final Map<EventId, YieldView> submitted = new ConcurrentHashMap<>();

    public GovernanceController(Weave weave, WeaveProperties props) {
        this.weave = weave;
        this.props = props;
    }

    record SubmitReq(Object content, String source, String reason, Set<String> requiredApprovers,
                     List<String> dependsOn, ApprovalStrategy strategy, Long timeoutMillis,
                     TurnKind originalKind, Double confidence, Double entropyCost) {}

    record ApproveReq(String approver) {}

    record RejectReq(String rejector, String reason) {}

    /** Record the yield and start waiting for approvals; the decision arrives later. */
    @PostMapping
    public ResponseEntity<YieldView> submit(@RequestBody SubmitReq req) {
        if (req.source() == null || req.source().isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        var turn = weave.submitYield(
                req.content(),
                req.source(),
                req.reason(),
                req.requiredApprovers() == null ? Set.of() : req.requiredApprovers(),
                LedgerController.ids(req.dependsOn()),
                req.originalKind() == null ? TurnKind.ACTION : req.originalKind(),
                null,
                null,
                req.confidence() == null ? 1.0 : req.confidence(),
                req.entropyCost() == null ? 0.0 : req.entropyCost());
        var timeout = req.timeoutMillis() == null
                ? props.getApproval().getDefaultTimeout()
                : Duration.ofMillis(req.timeoutMillis());
        var strategy = req.strategy() == null ? props.getApproval().getDefaultStrategy() : req.strategy();
        var view = YieldView.pending(turn);
        submitted.put(turn.id(), view);
        try {
            weave.requestApprovalAsync(turn, timeout, strategy)
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.warn("Approval wait for {} failed", turn.id(), error);
                            submitted.put(turn.id(), YieldView.of(turn, ApprovalStatus.TIMEOUT, null,
                                    String.valueOf(error.getMessage())));
                        } else {
                            submitted.put(turn.id(), YieldView.resolved(result));
                        }
                    });
        } catch (RuntimeException e) {
            submitted.remove(turn.id());
            throw e;
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(view);
    }

    @GetMapping
    public ResponseEntity<List<YieldView>> pending() {
        return ResponseEntity.ok(weave.yieldHandler().listPending().stream().map(YieldView::pending).toList());
    }

    /** Pending value, or the final decision once resolved. */
    @GetMapping("/{id}")
    public ResponseEntity<YieldView> get(@PathVariable("id") String id) {
        var yieldId = new EventId(id);
        var live = weave.yieldHandler().pending(yieldId);
        if (live.isPresent()) return ResponseEntity.ok(YieldView.pending(live.get()));
        var known = submitted.get(yieldId);
        return known == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(known);
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable("id") String id, @RequestBody ApproveReq req) {
        boolean folded = weave.yieldHandler().approve(new EventId(id), req.approver());
        if (!folded) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(Map.of("id", id, "approver", req.approver(), "accepted", true));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<Map<String, Object>> reject(@PathVariable("id") String id, @RequestBody RejectReq req) {
        boolean vetoed = weave.yieldHandler().reject(new EventId(id), req.rejector(), req.reason());
        if (!vetoed) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(Map.of("id", id, "rejector", String.valueOf(req.rejector()), "accepted", true));
    }
}
