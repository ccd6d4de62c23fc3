// file: src/main/java/io/kvbridge/client/BatchCallback.java
package io.kvbridge.client;

import com.fasterxml.jackson.databind.JsonNode;

/** Completion of batchGet, batchExists and batchSelect. Runs on the event loop. */
@FunctionalInterface
public interface BatchCallback {
    void onBatch(JsonNode error, JsonNode results) throws Exception;
}
