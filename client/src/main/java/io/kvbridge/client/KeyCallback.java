// file: src/main/java/io/kvbridge/client/KeyCallback.java
package io.kvbridge.client;

import com.fasterxml.jackson.databind.JsonNode;

/** Completion of remove. Runs on the event loop. */
@FunctionalInterface
public interface KeyCallback {
    void onKey(JsonNode error, JsonNode key) throws Exception;
}
