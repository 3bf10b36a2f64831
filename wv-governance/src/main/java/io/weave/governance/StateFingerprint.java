package io.weave.governance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.weave.core.Determinism;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Short, stable hash of a state snapshot: the first 16 hex chars of SHA-256 over the
 * snapshot's key-sorted JSON form. Objects Jackson cannot serialize are hashed by
 * their {@code toString()}.
 */
public final class StateFingerprint {
    private static final Logger log = LoggerFactory.getLogger(StateFingerprint.class);

    public static final String EMPTY = "empty";

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private StateFingerprint() {}

    public static String of(Object snapshot) {
        if (snapshot == null) return EMPTY;
        String text;
        try {
            text = CANONICAL.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.debug("Snapshot {} not serializable, hashing toString: {}", snapshot.getClass().getName(), e.getMessage());
            text = String.valueOf(snapshot);
        }
        return Determinism.sha256Hex(text).substring(0, 16);
    }
}
