package io.weave.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KnotEventTest {

    @Test
    void idDependsOnlyOnTheSynchronizedSet() {
        var x = new EventId("x");
        var y = new EventId("y");

        var k1 = KnotEvent.over(List.of(x, y), Instant.EPOCH);
        var k2 = KnotEvent.over(List.of(y, x), Instant.EPOCH.plusSeconds(5));

        assertThat(k1.id()).isEqualTo(k2.id());
        assertThat(k1.id().value()).startsWith("knot-").hasSize(21);
        assertThat(KnotEvent.idFor(List.of(x))).isNotEqualTo(k1.id());
    }

    @Test
    void carriesSentinelContentAndSystemSource() {
        var knot = KnotEvent.over(List.of(), Instant.EPOCH);

        assertThat(knot.content()).isEqualTo(KnotEvent.CONTENT);
        assertThat(knot.source()).isEqualTo(KnotEvent.SYSTEM_SOURCE);
        assertThat(knot.synchronizedIds()).isEmpty();
    }
}
