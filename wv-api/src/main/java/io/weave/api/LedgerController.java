package io.weave.api;

import io.weave.core.Determinism;
import io.weave.core.Event;
import io.weave.core.EventId;
import io.weave.core.SimpleEvent;
import io.weave.governance.Weave;
import io.weave.ledger.Ledger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class LedgerController {
    private final Weave weave;

    public LedgerController(Weave weave) { this.weave = weave; }

    /** {@code id} is optional; supply it to fulfil an earlier forward reference. */
    record AppendReq(String id, Object content, String source, List<String> dependsOn) {}

    record JoinReq(List<String> sources) {}

    @PostMapping("/events")
    public ResponseEntity<EventView> append(@RequestBody AppendReq req) {
        if (req.source() == null || req.source().isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        Event<?> event;
        if (req.id() == null || req.id().isBlank()) {
            event = weave.record(req.content(), req.source(), ids(req.dependsOn()));
        } else {
            event = new SimpleEvent<>(new EventId(req.id()), req.content(), Determinism.now(), req.source());
            ledger().append(event, ids(req.dependsOn()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(view(event));
    }

    /** All events, dependencies first. */
    @GetMapping("/events")
    public ResponseEntity<List<EventView>> linearize() {
        return ResponseEntity.ok(views(ledger().linearize()));
    }

    @GetMapping("/events/{id}")
    public ResponseEntity<EventView> get(@PathVariable("id") String id) {
        return ledger().get(new EventId(id))
                .map(e -> ResponseEntity.ok(view(e)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/events/{id}/dependencies")
    public ResponseEntity<Map<String, Object>> dependencies(@PathVariable("id") String id) {
        var eventId = new EventId(id);
        if (!ledger().contains(eventId)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(Map.of(
                "direct", ledger().dependencies(eventId).stream().map(EventId::value).sorted().toList(),
                "transitive", ledger().allDependencies(eventId).stream().map(EventId::value).sorted().toList(),
                "concurrent", ledger().findConcurrent(eventId).stream().map(e -> e.id().value()).toList()
        ));
    }

    /** What a source can see. */
    @GetMapping("/sources/{source}/projection")
    public ResponseEntity<List<EventView>> project(@PathVariable("source") String source) {
        return ResponseEntity.ok(views(ledger().project(source)));
    }

    @PostMapping("/knots")
    public ResponseEntity<EventView> join(@RequestBody JoinReq req) {
        var knot = weave.join(req.sources() == null ? List.of() : req.sources());
        return ResponseEntity.status(HttpStatus.CREATED).body(view(knot));
    }

    private Ledger ledger() { return weave.ledger(); }

    private EventView view(Event<?> e) { return EventView.of(e, ledger().dependencies(e.id())); }

    private List<EventView> views(List<Event<?>> events) { return events.stream().map(this::view).toList(); }

    static List<EventId> ids(List<String> raw) {
        return raw == null ? List.of() : raw.stream().map(EventId::new).toList();
    }
}
