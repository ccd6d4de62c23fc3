// file: src/main/java/io/kvbridge/core/policy/BatchPolicy.java
package io.kvbridge.core.policy;

/** Options for batch reads. */
public record BatchPolicy(long timeoutMillis) {

    public static final BatchPolicy DEFAULT = new BatchPolicy(0);

    public BatchPolicy {
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeout must be >= 0");
    }
}
