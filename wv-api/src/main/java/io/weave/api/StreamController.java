package io.weave.api;

import io.weave.core.Event;
import io.weave.ledger.Ledger;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.Flow;

@RestController
@RequestMapping("/api/stream")
public class StreamController {

    private final Ledger ledger;
    private final GovernanceStream governance;
    private final WeaveProperties props;

    public StreamController(Ledger ledger, GovernanceStream governance, WeaveProperties props) {
        this.ledger = ledger;
        this.governance = governance;
        this.props = props;
    }

    /** Stream appended events (source optional via query). */
    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(name = "source", required = false) String source) {
        return subscribeFiltering(source);
    }

    /** Approval requests and their outcomes. */
    @GetMapping(path = "/governance", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter governance() {
        return governance.open(props.getStream().getTimeout());
    }

    private SseEmitter subscribeFiltering(String sourceOrNull) {
        final String sourceFilter = (sourceOrNull == null || sourceOrNull.isBlank()) ? null : sourceOrNull;
        final SseEmitter emitter = new SseEmitter(props.getStream().getTimeout().toMillis());

        Flow.Subscriber<Event<?>> sub = new Flow.Subscriber<>() {
            Flow.Subscription s;

            @Override public void onSubscribe(Flow.Subscription s) { (this.s = s).request(Long.MAX_VALUE); }

            @Override public void onNext(Event<?> e) {
                try {
                    if (sourceFilter == null || sourceFilter.equals(e.source())) {
                        emitter.send(SseEmitter.event().name("event").data(EventView.of(e, ledger.dependencies(e.id()))));
                    }
                } catch (IOException | IllegalStateException ex) {
                    emitter.completeWithError(ex);
                    if (s != null) s.cancel();
                }
            }

            @Override public void onError(Throwable t) { emitter.completeWithError(t); }
            @Override public void onComplete() { emitter.complete(); }
        };

        ledger.subscribe().subscribe(sub);
        return emitter;
    }
}
