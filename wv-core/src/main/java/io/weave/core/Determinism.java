package io.weave.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Deterministic execution utilities.
 *
 * Scope provides:
 *  - Clock starting at EPOCH + seed seconds (UTC), advancing one millisecond per read
 *  - Seeded RNG (L64X256MixRandom) for reproducible ids
 *  - Logical node identity
 *
 * The scope is bound to the calling thread and restored on exit, so scopes nest.
 */
public final class Determinism {

    private static final ThreadLocal<Scope> SCOPE = new ThreadLocal<>();

    private static final String ENV_NODE =
            Optional.ofNullable(System.getenv("WV_NODE"))
                    .filter(s -> !s.isBlank())
                    .orElse(null);

    private Determinism() {}

    private static final class Scope {
        final String node;
        final RandomGenerator rng;
        final Instant origin;
        long ticks;

        Scope(String node, long seed) {
            this.node = node;
            this.rng = RandomGeneratorFactory.of("L64X256MixRandom").create(seed);
            this.origin = Instant.EPOCH.plusSeconds(seed & 0xFFFF_FFFFL);
        }

        Instant next() { return origin.plusMillis(ticks++); }
    }

    /* ---------- Scope management ---------- */

    /**
     * Run under a deterministic scope.
     * Clock = EPOCH + seed seconds (UTC), RNG = L64X256MixRandom(seed), NODE = node (or "api").
     */
    public static <T> T withDeterminism(String node, long seed, Supplier<T> body) {
        Objects.requireNonNull(body);
        var previous = SCOPE.get();
        SCOPE.set(new Scope((node == null || node.isBlank()) ? "api" : node, seed));
        try {
            return body.get();
        } finally {
            if (previous == null) SCOPE.remove(); else SCOPE.set(previous);
        }
    }

    /** Runnable overload. */
    public static void withDeterminism(String node, long seed, Runnable body) {
        withDeterminism(node, seed, () -> { body.run(); return null; });
    }

    /** True when the calling thread runs inside a deterministic scope. */
    public static boolean inScope() { return SCOPE.get() != null; }

    /** Derive a 64-bit seed from arbitrary parts (stable). */
    public static long seedFrom(Object... parts) {
        var md = sha256();
        for (Object p : parts) md.update(Objects.toString(p, "null").getBytes(StandardCharsets.UTF_8));
        var bytes = md.digest();
        // take first 8 bytes as signed long
        return ByteBuffer.wrap(bytes, 0, 8).getLong();
    }

    /** Lowercase hex SHA-256 of the given text. */
    public static String sha256Hex(String text) {
        var bytes = sha256().digest(text.getBytes(StandardCharsets.UTF_8));
        var sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        return sb.toString();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /* ---------- Accessors ---------- */

    /** Fixed clock at the scope's next instant, system UTC if not in scope. */
    public static Clock clock() { return Clock.fixed(now(), ZoneOffset.UTC); }

    /** Now using the deterministic clock if present. Scoped reads are strictly increasing. */
    public static Instant now() {
        var scope = SCOPE.get();
        return scope == null ? Instant.now() : scope.next();
    }

    /**
     * Effective node name.
     * Precedence: scope node → env(WV_NODE) → "api"
     */
    public static String node() {
        var scope = SCOPE.get();
        if (scope != null) return scope.node;
        return ENV_NODE != null ? ENV_NODE : "api";
    }

    /** Current RNG (default JDK if not in scope). */
    public static RandomGenerator rng() {
        var scope = SCOPE.get();
        return scope == null ? RandomGenerator.getDefault() : scope.rng;
    }

    /* ---------- Deterministic helpers ---------- */

    /** Deterministic UUID from current RNG (or default RNG). */
    public static UUID randomUUID() { return randomUUID(rng()); }

    /** Deterministic UUID from a specific RNG (sets v4/version+variant bits). */
    public static UUID randomUUID(RandomGenerator r) {
        byte[] b = new byte[16];
        r.nextBytes(b);
        b[6] = (byte) ((b[6] & 0x0f) | 0x40); // version 4
        b[8] = (byte) ((b[8] & 0x3f) | 0x80); // variant 2
        var bb = ByteBuffer.wrap(b);
        long msb = bb.getLong();
        long lsb = bb.getLong();
        return new UUID(msb, lsb);
    }
}
