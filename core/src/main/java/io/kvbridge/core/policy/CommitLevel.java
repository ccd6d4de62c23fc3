// file: src/main/java/io/kvbridge/core/policy/CommitLevel.java
package io.kvbridge.core.policy;

/** Replicas that must acknowledge a write before it is reported successful. */
public enum CommitLevel { ALL, MASTER }
