// file: src/main/java/io/kvbridge/core/policy/RemovePolicy.java
package io.kvbridge.core.policy;

import io.kvbridge.core.RecordMeta;

import java.util.Objects;

/**
 * Options for remove.
 *
 * @param generation expected generation, compared according to {@code gen}
 */
public record RemovePolicy(
        long timeoutMillis,
        GenerationPolicy gen,
        int generation,
        KeyPolicy key,
        RetryPolicy retry
) {

    public static final RemovePolicy DEFAULT = new RemovePolicy(
            0, GenerationPolicy.IGNORE, RecordMeta.GENERATION_UNSET, KeyPolicy.DIGEST, RetryPolicy.NONE);

    public RemovePolicy {
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeout must be >= 0");
        Objects.requireNonNull(gen, "gen");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(retry, "retry");
        if (generation < 0 || generation > RecordMeta.GENERATION_MAX) {
            throw new IllegalArgumentException("generation out of range: " + generation);
        }
    }
}
