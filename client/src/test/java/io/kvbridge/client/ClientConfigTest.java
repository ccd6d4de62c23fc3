// file: src/test/java/io/kvbridge/client/ClientConfigTest.java
package io.kvbridge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvbridge.core.policy.ExistsPolicy;
import io.kvbridge.core.policy.GenerationPolicy;
import io.kvbridge.core.policy.KeyPolicy;
import io.kvbridge.core.policy.OperatePolicy;
import io.kvbridge.core.policy.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies client settings and default policies load from JSON.
 */
class ClientConfigTest {

    @TempDir
    Path tmp;

    @Test
    void loads_hosts_pool_settings_and_policies_from_file() throws Exception {
        Path cfgPath = Paths.get(getClass().getResource("/client-config.json").toURI());

        ClientConfig cfg = ClientConfig.fromJsonFile(cfgPath);

        assertEquals(2, cfg.hosts().size());
        assertEquals(new ClientConfig.Host("127.0.0.1", 3000), cfg.hosts().get(0));
        assertEquals(6, cfg.workerThreads());
        assertEquals(512, cfg.workerQueueCapacity());
        assertEquals(Duration.ofMillis(2500), cfg.shutdownTimeout());
        assertEquals(Level.FINE, cfg.logLevel());

        assertEquals(100, cfg.policies().read().timeoutMillis());
        assertEquals(RetryPolicy.ONCE, cfg.policies().read().retry());
        assertEquals(200, cfg.policies().write().timeoutMillis());
        assertEquals(ExistsPolicy.CREATE, cfg.policies().write().exists());
        assertEquals(KeyPolicy.SEND, cfg.policies().write().key());
        assertEquals(GenerationPolicy.EQ, cfg.policies().remove().gen());
        assertSame(OperatePolicy.DEFAULT, cfg.policies().operate());
        assertEquals(400, cfg.policies().batch().timeoutMillis());
    }

    @Test
    void empty_object_yields_defaults() {
        ClientConfig cfg = ClientConfig.fromJson(new ObjectMapper().createObjectNode());
        assertTrue(cfg.hosts().isEmpty());
        assertEquals(0, cfg.workerThreads());
        assertNull(cfg.logLevel());
        assertEquals(ClientConfig.DEFAULT.policies(), cfg.policies());
    }

    @Test
    void invalid_values_are_rejected() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromJson(mapper.readTree("{\"workerThreads\":-1}")));
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromJson(mapper.readTree("{\"hosts\":[{\"addr\":\"h\",\"port\":0}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromJson(mapper.readTree("{\"policies\":{\"read\":{\"timeout\":-5}}}")));
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromJson(mapper.readTree("{\"logLevel\":\"LOUD\"}")));

        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromJson(mapper.readTree("{\"hosts\":[{\"port\":3000}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromJson(mapper.readTree("{\"hosts\":[null]}")));

        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromJsonFile(broken));
    }
}
