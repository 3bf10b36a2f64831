package io.weave.governance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time summary of a {@link Weave}.
 *
 * @param coneStats          compression ratio per source
 * @param averageCompression mean of {@code coneStats}, 0 when there are no sources
 */
public record WeaveMetrics(
        int totalEvents,
        Map<TurnKind, Integer> byKind,
        Map<String, Integer> bySource,
        int pendingYields,
        double averageCompression,
        Map<String, Double> coneStats
) {
    public WeaveMetrics {
        var kinds = new EnumMap<TurnKind, Integer>(TurnKind.class);
        kinds.putAll(byKind);
        byKind = Collections.unmodifiableMap(kinds);
        bySource = Collections.unmodifiableMap(new LinkedHashMap<>(bySource));
        coneStats = Collections.unmodifiableMap(new LinkedHashMap<>(coneStats));
    }
}
