// file: src/main/java/io/kvbridge/core/policy/ReadPolicy.java
package io.kvbridge.core.policy;

import java.util.Objects;

/**
 * Options for single-record reads (get, select, exists).
 *
 * @param timeoutMillis per-call timeout enforced by the store; 0 means no limit
 */
public record ReadPolicy(long timeoutMillis, KeyPolicy key, RetryPolicy retry) {

    public static final ReadPolicy DEFAULT = new ReadPolicy(0, KeyPolicy.DIGEST, RetryPolicy.NONE);

    public ReadPolicy {
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeout must be >= 0");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(retry, "retry");
    }
}
