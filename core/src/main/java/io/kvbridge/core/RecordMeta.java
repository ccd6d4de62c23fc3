// file: src/main/java/io/kvbridge/core/RecordMeta.java
package io.kvbridge.core;

/**
 * Record metadata: generation counter and time-to-live.
 * <p>
 * generation is an unsigned 16-bit counter. Stores start it at 1 and wrap
 * back to 1 after {@link #GENERATION_MAX}; {@link #GENERATION_UNSET} means
 * "not supplied" on input.
 * <p>
 * ttl is in seconds. {@link #TTL_NEVER_EXPIRE} (0) keeps the record forever,
 * {@link #TTL_NO_CHANGE} (-1) leaves the current expiry untouched on write.
 */
public record RecordMeta(int generation, long ttl) {

    public static final int GENERATION_UNSET = 0;
    public static final int GENERATION_MAX = 0xFFFF;
    public static final long TTL_NEVER_EXPIRE = 0L;
    public static final long TTL_NO_CHANGE = -1L;
    public static final long TTL_MAX = 0xFFFF_FFFFL;

    /** Write metadata that asks for nothing: no generation check, no TTL change. */
    public static final RecordMeta NONE = new RecordMeta(GENERATION_UNSET, TTL_NO_CHANGE);

    public RecordMeta {
        if (generation < 0 || generation > GENERATION_MAX) {
            throw new IllegalArgumentException("generation out of range: " + generation);
        }
        if (ttl < TTL_NO_CHANGE || ttl > TTL_MAX) {
            throw new IllegalArgumentException("ttl out of range: " + ttl);
        }
    }

    /** Next generation after a successful write. */
    public static int nextGeneration(int current) {
        return current >= GENERATION_MAX ? 1 : current + 1;
    }
}
