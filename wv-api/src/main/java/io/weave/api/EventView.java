package io.weave.api;

import io.weave.core.Event;
import io.weave.core.EventId;
import io.weave.core.KnotEvent;
import io.weave.governance.Turn;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record EventView(
        String id,
        String source,
        Instant timestamp,
        String kind,
        Object content,
        List<String> dependsOn
) {
    static EventView of(Event<?> e, Set<EventId> dependsOn) {
        String kind;
        if (e instanceof Turn<?> t) kind = t.kind().name();
        else if (e instanceof KnotEvent) kind = KnotEvent.CONTENT;
        else kind = "EVENT";
        return new EventView(
                e.id().value(),
                e.source(),
                e.timestamp(),
                kind,
                e.content(),
                dependsOn.stream().map(EventId::value).sorted().toList()
        );
    }
}
