// file: src/main/java/io/kvbridge/client/RecordCallback.java
package io.kvbridge.client;

import com.fasterxml.jackson.databind.JsonNode;

/** Completion of get, select and operate. Runs on the event loop. */
@FunctionalInterface
public interface RecordCallback {
    void onRecord(JsonNode error, JsonNode bins, JsonNode meta, JsonNode key) throws Exception;
}
