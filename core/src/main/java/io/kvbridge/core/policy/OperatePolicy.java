// file: src/main/java/io/kvbridge/core/policy/OperatePolicy.java
package io.kvbridge.core.policy;

import java.util.Objects;

/** Options for operate. */
public record OperatePolicy(
        long timeoutMillis,
        GenerationPolicy gen,
        KeyPolicy key,
        CommitLevel commitLevel,
        RetryPolicy retry
) {

    public static final OperatePolicy DEFAULT = new OperatePolicy(
            0, GenerationPolicy.IGNORE, KeyPolicy.DIGEST, CommitLevel.ALL, RetryPolicy.NONE);

    public OperatePolicy {
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeout must be >= 0");
        Objects.requireNonNull(gen, "gen");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(commitLevel, "commitLevel");
        Objects.requireNonNull(retry, "retry");
    }
}
