// file: src/main/java/io/kvbridge/core/Key.java
package io.kvbridge.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Identity of a record: namespace, set and a user key.
 * <p>
 * Invariants:
 *  - namespace is non-blank.
 *  - set is never null (empty string means "no set").
 *  - exactly one user key variant is populated; the sealed {@link UserKey}
 *    hierarchy makes any other shape unrepresentable.
 */
public record Key(String namespace, String set, UserKey userKey) {

    public Key {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(userKey, "userKey");
        if (namespace.isBlank()) throw new IllegalArgumentException("namespace must not be blank");
        set = set == null ? "" : set;
    }

    public static Key of(String namespace, String set, long key) {
        return new Key(namespace, set, new UserKey.IntegerKey(key));
    }

    public static Key of(String namespace, String set, String key) {
        return new Key(namespace, set, new UserKey.StringKey(key));
    }

    public static Key of(String namespace, String set, byte[] key) {
        return new Key(namespace, set, new UserKey.BytesKey(key));
    }

    @Override
    public String toString() {
        return namespace + ":" + set + ":" + userKey;
    }

    /** The three user key variants. */
    public sealed interface UserKey permits UserKey.IntegerKey, UserKey.StringKey, UserKey.BytesKey {

        record IntegerKey(long value) implements UserKey {
            @Override public String toString() { return Long.toString(value); }
        }

        record StringKey(String value) implements UserKey {
            public StringKey {
                Objects.requireNonNull(value, "value");
            }

            @Override public String toString() { return value; }
        }

        final class BytesKey implements UserKey {
            private final byte[] value;

            public BytesKey(byte[] value) {
                this.value = Arrays.copyOf(Objects.requireNonNull(value, "value"), value.length);
            }

            public byte[] value() { return Arrays.copyOf(value, value.length); }

            @Override public boolean equals(Object o) {
                if (this == o) return true;
                if (!(o instanceof BytesKey other)) return false;
                return Arrays.equals(value, other.value);
            }

            @Override public int hashCode() { return Arrays.hashCode(value); }

            @Override public String toString() { return "bytes[" + value.length + "]"; }
        }
    }
}
