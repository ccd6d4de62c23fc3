// file: src/main/java/io/kvbridge/core/policy/GenerationPolicy.java
package io.kvbridge.core.policy;

/**
 * How a write compares the caller's expected generation with the stored one.
 *  - IGNORE: no check.
 *  - EQ:     write only if expected == stored.
 *  - GT:     write only if expected > stored.
 */
public enum GenerationPolicy { IGNORE, EQ, GT }
