// file: src/main/java/io/kvbridge/client/dto/JsonConfig.java
package io.kvbridge.client.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Jackson binding target for the client config file. Absent fields keep these defaults. */
public class JsonConfig {
    public List<JsonHost> hosts = List.of();
    public int workerThreads;
    public int workerQueueCapacity = 10_000;
    public long shutdownTimeoutMillis = 5_000;
    public String logLevel;
    public JsonNode policies;

    public static class JsonHost {
        public String addr;
        public int port;
    }
}
