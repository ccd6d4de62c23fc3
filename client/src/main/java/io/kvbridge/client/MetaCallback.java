// file: src/main/java/io/kvbridge/client/MetaCallback.java
package io.kvbridge.client;

import com.fasterxml.jackson.databind.JsonNode;

/** Completion of exists and put. Runs on the event loop. */
@FunctionalInterface
public interface MetaCallback {
    void onMeta(JsonNode error, JsonNode meta, JsonNode key) throws Exception;
}
