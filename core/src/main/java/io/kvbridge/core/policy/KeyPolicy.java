// file: src/main/java/io/kvbridge/core/policy/KeyPolicy.java
package io.kvbridge.core.policy;

/** Whether the store keeps only the key's identity (DIGEST) or the user key too (SEND). */
public enum KeyPolicy { DIGEST, SEND }
