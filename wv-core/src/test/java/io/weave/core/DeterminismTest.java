package io.weave.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DeterminismTest {

    @Test
    void sameSeedYieldsSameIdsAndTimestamps() {
        var first = Determinism.withDeterminism("alice", 7L, () -> Event.of("x", "alice"));
        var second = Determinism.withDeterminism("alice", 7L, () -> Event.of("x", "alice"));

        assertThat(first.id()).isEqualTo(second.id());
        assertThat(first.timestamp()).isEqualTo(second.timestamp());
    }

    @Test
    void scopedClockIsStrictlyIncreasing() {
        Determinism.withDeterminism("n", 1L, () -> {
            Instant t1 = Determinism.now();
            Instant t2 = Determinism.now();
            assertThat(t2).isAfter(t1);
        });
    }

    @Test
    void scopesNestAndRestore() {
        assertThat(Determinism.inScope()).isFalse();
        Determinism.withDeterminism("outer", 1L, () -> {
            Determinism.withDeterminism("inner", 2L, () -> assertThat(Determinism.node()).isEqualTo("inner"));
            assertThat(Determinism.node()).isEqualTo("outer");
        });
        assertThat(Determinism.inScope()).isFalse();
    }

    @Test
    void blankNodeFallsBackToApi() {
        Determinism.withDeterminism(" ", 3L, () -> assertThat(Determinism.node()).isEqualTo("api"));
    }

    @Test
    void seedFromIsStable() {
        assertThat(Determinism.seedFrom("a", 1, null)).isEqualTo(Determinism.seedFrom("a", 1, null));
        assertThat(Determinism.seedFrom("a")).isNotEqualTo(Determinism.seedFrom("b"));
    }

    @Test
    void randomUuidIsVersion4() {
        assertThat(Determinism.randomUUID().version()).isEqualTo(4);
    }
}
