package io.weave.api;

import io.weave.core.Event;
import io.weave.governance.Weave;
import io.weave.governance.WeaveMetrics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ContextController {

    private final Weave weave;

    public ContextController(Weave weave) {
        this.weave = weave;
    }

    public record ContextView(String source, int coneSize, int totalEvents, double compressionRatio,
                              List<EventView> events) {}

    /** Minimal causal context {@code source} needs before acting. */
    @GetMapping("/context/{source}")
    public ResponseEntity<ContextView> context(@PathVariable("source") String source) {
        var cone = weave.cone();
        List<Event<?>> context = cone.projectContext(source);
        var events = context.stream()
                .map(e -> EventView.of(e, cone.view().dependencies(e.id())))
                .toList();
        return ResponseEntity.ok(new ContextView(
                source,
                events.size(),
                cone.view().size(),
                cone.compressionRatio(source),
                events
        ));
    }

    @GetMapping("/metrics")
    public ResponseEntity<WeaveMetrics> metrics() {
        return ResponseEntity.ok(weave.metrics());
    }
}
