// file: src/main/java/io/kvbridge/core/StoreRecord.java
package io.kvbridge.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record: ordered bins plus metadata.
 * <p>
 * Bin names are unique (map keys) and at most {@link #BIN_NAME_MAX_LENGTH}
 * characters. A {@link Value.NullValue} bin is only meaningful on input,
 * where it asks the store to drop that bin.
 */
public final class StoreRecord {

    public static final int BIN_NAME_MAX_LENGTH = 14;

    private final Map<String, Value> bins;
    private final RecordMeta meta;

    public StoreRecord(Map<String, Value> bins, RecordMeta meta) {
        Objects.requireNonNull(bins, "bins");
        for (String name : bins.keySet()) {
            checkBinName(name);
        }
        this.bins = Collections.unmodifiableMap(new LinkedHashMap<>(bins));
        this.meta = Objects.requireNonNull(meta, "meta");
    }

    /** Record with bins to write and no metadata request. */
    public static StoreRecord of(Map<String, Value> bins) {
        return new StoreRecord(bins, RecordMeta.NONE);
    }

    public Map<String, Value> bins() { return bins; }

    public RecordMeta meta() { return meta; }

    public Value bin(String name) { return bins.get(name); }

    public int generation() { return meta.generation(); }

    public long ttl() { return meta.ttl(); }

    /** Throws IllegalArgumentException when {@code name} is not a legal bin name. */
    public static void checkBinName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("bin name must not be empty");
        }
        if (name.length() > BIN_NAME_MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "bin name '%s' exceeds %d characters".formatted(name, BIN_NAME_MAX_LENGTH));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoreRecord other)) return false;
        return bins.equals(other.bins) && meta.equals(other.meta);
    }

    @Override public int hashCode() { return Objects.hash(bins, meta); }

    @Override public String toString() { return "StoreRecord" + bins + meta; }
}
