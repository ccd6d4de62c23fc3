// file: src/main/java/io/kvbridge/core/policy/WritePolicy.java
package io.kvbridge.core.policy;

import java.util.Objects;

/** Options for put. */
public record WritePolicy(
        long timeoutMillis,
        GenerationPolicy gen,
        KeyPolicy key,
        ExistsPolicy exists,
        CommitLevel commitLevel,
        RetryPolicy retry
) {

    public static final WritePolicy DEFAULT = new WritePolicy(
            0, GenerationPolicy.IGNORE, KeyPolicy.DIGEST, ExistsPolicy.IGNORE, CommitLevel.ALL, RetryPolicy.NONE);

    public WritePolicy {
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeout must be >= 0");
        Objects.requireNonNull(gen, "gen");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(exists, "exists");
        Objects.requireNonNull(commitLevel, "commitLevel");
        Objects.requireNonNull(retry, "retry");
    }
}
