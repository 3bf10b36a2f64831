package io.weave.api;

import io.weave.governance.ApprovalStatus;
import io.weave.governance.GovernanceListener;
import io.weave.governance.YieldHandler;
import io.weave.governance.YieldTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Fans approval lifecycle callbacks out to SSE clients. */
@Component
public class GovernanceStream implements GovernanceListener {
    private static final Logger log = LoggerFactory.getLogger(GovernanceStream.class);

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public GovernanceStream(YieldHandler handler) {
        handler.addListener(this);
    }

    public SseEmitter open(Duration timeout) {
        var emitter = new SseEmitter(timeout.toMillis());
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(t -> emitters.remove(emitter));
        return emitter;
    }

    int clients() { return emitters.size(); }

    @Override public void onRequested(YieldTurn<?> turn) {
        broadcast("requested", YieldView.pending(turn));
    }

    @Override public void onApproval(YieldTurn<?> turn) {
        broadcast("approved", YieldView.of(turn, ApprovalStatus.APPROVED, null, null));
    }

    @Override public void onRejection(YieldTurn<?> turn, String rejector, String reason) {
        broadcast("rejected", YieldView.of(turn, ApprovalStatus.REJECTED, rejector, reason));
    }

    @Override public void onTimeout(YieldTurn<?> turn) {
        broadcast("timeout", YieldView.of(turn, ApprovalStatus.TIMEOUT, null, null));
    }

    private void broadcast(String name, YieldView view) {
        for (var emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(name).data(view));
            } catch (IOException | IllegalStateException e) {
                log.warn("Dropping governance stream client: {}", e.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(e);
            }
        }
    }
}
