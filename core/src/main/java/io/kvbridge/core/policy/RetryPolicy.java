// file: src/main/java/io/kvbridge/core/policy/RetryPolicy.java
package io.kvbridge.core.policy;

/** Whether the store may retry a call that failed transiently. */
public enum RetryPolicy { NONE, ONCE }
