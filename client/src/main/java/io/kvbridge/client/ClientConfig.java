// file: src/main/java/io/kvbridge/client/ClientConfig.java
package io.kvbridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.convert.PolicyParser;
import io.kvbridge.client.dto.JsonConfig;
import io.kvbridge.core.policy.Policies;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;

/**
 * Client settings.
 * <p>
 * Fields:
 *  - hosts: seed addresses, passed through to remote store handles.
 *  - workerThreads: 0 uses the process-wide {@code WorkerPool.shared()},
 *    otherwise the client owns a private pool of that size.
 *  - workerQueueCapacity: bound of a private pool's queue.
 *  - shutdownTimeout: how long close() waits for in-flight operations.
 *  - logLevel: level for the {@code io.kvbridge} logger, null leaves it alone.
 *  - policies: defaults used when an operation carries no policy argument.
 */
public record ClientConfig(
        List<Host> hosts,
        int workerThreads,
        int workerQueueCapacity,
        Duration shutdownTimeout,
        Level logLevel,
        Policies policies
) {

    public record Host(String addr, int port) {
        public Host {
            if (addr == null || addr.isBlank()) throw new IllegalArgumentException("addr must not be blank");
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
        }
    }

    public static final ClientConfig DEFAULT = new ClientConfig(
            List.of(), 0, 10_000, Duration.ofSeconds(5), null, Policies.DEFAULT);

    public ClientConfig {
        hosts = List.copyOf(Objects.requireNonNull(hosts, "hosts"));
        if (workerThreads < 0) throw new IllegalArgumentException("workerThreads must be >= 0");
        if (workerQueueCapacity <= 0) throw new IllegalArgumentException("workerQueueCapacity must be > 0");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (shutdownTimeout.isNegative()) throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        policies = policies == null ? Policies.DEFAULT : policies;
    }

    public ClientConfig withPolicies(Policies policies) {
        return new ClientConfig(hosts, workerThreads, workerQueueCapacity, shutdownTimeout, logLevel, policies);
    }

    public ClientConfig withWorkerThreads(int workerThreads) {
        return new ClientConfig(hosts, workerThreads, workerQueueCapacity, shutdownTimeout, logLevel, policies);
    }

    public static ClientConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return fromDto(mapper.readValue(path.toFile(), JsonConfig.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load ClientConfig from " + path, e);
        }
    }

    public static ClientConfig fromJson(JsonNode node) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return fromDto(mapper.treeToValue(node, JsonConfig.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid ClientConfig: " + e.getOriginalMessage(), e);
        }
    }

    private static ClientConfig fromDto(JsonConfig cfg) {
        List<Host> hosts = cfg.hosts == null
                ? List.of()
                : cfg.hosts.stream().map(ClientConfig::hostFromDto).toList();
        Policies policies;
        try {
            policies = PolicyParser.policiesFromJson(cfg.policies);
        } catch (ParameterException e) {
            throw new IllegalArgumentException("Invalid policies in ClientConfig: " + e.getMessage(), e);
        }
        return new ClientConfig(
                hosts,
                cfg.workerThreads,
                cfg.workerQueueCapacity,
                Duration.ofMillis(cfg.shutdownTimeoutMillis),
                parseLevel(cfg.logLevel),
                policies
        );
    }

    private static Host hostFromDto(JsonConfig.JsonHost h) {
        if (h == null) throw new IllegalArgumentException("hosts entries must be {addr, port} objects");
        return new Host(h.addr, h.port);
    }

    private static Level parseLevel(String level) {
        if (level == null || level.isBlank()) {
            return null;
        }
        return Level.parse(level.trim().toUpperCase(Locale.ROOT));
    }
}
