package com.mdtodo.todo;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Time-ordered version 7 UUIDs (RFC 9562).
 *
 * <p>Layout: 48-bit unix epoch millis, version nibble {@code 7}, 12-bit counter, variant {@code 10},
 * 62 random bits. The counter keeps ids issued within the same millisecond strictly increasing; when
 * it overflows the timestamp field is advanced by one.
 */
public final class UuidV7 {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int MAX_COUNTER = 0xFFF;

    private static long lastMillis = -1L;
    private static int counter;

    private UuidV7() {}

    public static UUID generate() {
        return generate(System.currentTimeMillis());
    }

    static synchronized UUID generate(long nowMillis) {
        if (nowMillis > lastMillis) {
            lastMillis = nowMillis;
            // leave headroom in the upper half for same-millisecond increments
            counter = RANDOM.nextInt(MAX_COUNTER / 2);
        } else if (++counter > MAX_COUNTER) {
            lastMillis++;
            counter = 0;
        }

        long msb = (lastMillis & 0xFFFF_FFFF_FFFFL) << 16 | 0x7000L | counter;
        long lsb = RANDOM.nextLong() & 0x3FFF_FFFF_FFFF_FFFFL | 0x8000_0000_0000_0000L;
        return new UUID(msb, lsb);
    }

    /** Millisecond timestamp encoded in a v7 id. */
    public static long timestampOf(UUID id) {
        if (id.version() != 7) throw new IllegalArgumentException("not a v7 uuid: " + id);
        return id.getMostSignificantBits() >>> 16;
    }
}
