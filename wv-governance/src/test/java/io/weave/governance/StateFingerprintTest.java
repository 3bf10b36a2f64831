package io.weave.governance;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StateFingerprintTest {

    @Test
    void nullIsEmptySentinel() {
        assertThat(StateFingerprint.of(null)).isEqualTo(StateFingerprint.EMPTY);
    }

    @Test
    void mapKeyOrderDoesNotMatter() {
        var first = new LinkedHashMap<String, Object>();
        first.put("b", 2);
        first.put("a", List.of(1, 2));
        var second = new LinkedHashMap<String, Object>();
        second.put("a", List.of(1, 2));
        second.put("b", 2);

        assertThat(StateFingerprint.of(first)).isEqualTo(StateFingerprint.of(second)).hasSize(16);
    }

    @Test
    void differentStatesDiffer() {
        assertThat(StateFingerprint.of(Map.of("n", 1))).isNotEqualTo(StateFingerprint.of(Map.of("n", 2)));
    }

    @Test
    void plainObjectsAreHashed() {
        assertThat(StateFingerprint.of(new Object())).hasSize(16);
    }
}
