// file: src/test/java/io/kvbridge/bench/AsyncClientBenchTest.java
package io.kvbridge.bench;

import io.kvbridge.client.AsyncClient;
import io.kvbridge.client.ClientConfig;
import io.kvbridge.storage.MemoryStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AsyncClientBenchTest {

    @Test
    void zipf_ids_stay_in_range_and_favour_low_ranks() {
        var zipf = new ZipfianKeyGenerator(100, 1.2);
        int[] hits = new int[100];
        for (int i = 0; i < 20_000; i++) {
            int k = zipf.nextKey();
            assertTrue(k >= 0 && k < 100);
            hits[k]++;
        }
        assertTrue(hits[0] > hits[50]);
        assertThrows(IllegalArgumentException.class, () -> new ZipfianKeyGenerator(0, 1.0));
    }

    @Test
    void small_run_completes_every_operation() throws Exception {
        try (AsyncClient client = new AsyncClient(new MemoryStore(), ClientConfig.DEFAULT.withWorkerThreads(2))) {
            AsyncClientBench.Result r = AsyncClientBench.run(client, 500, 16, new ZipfianKeyGenerator(20, 0.99), 0.5);
            assertEquals(500, r.ok() + r.errors());
            assertEquals(0, r.errors());
        }
    }

    @Test
    void args_are_parsed_as_flag_value_pairs() {
        assertEquals(Map.of("ops", "10", "zipf-skew", "0.5"),
                AsyncClientBench.parseArgs(new String[]{"--ops", "10", "--zipf-skew", "0.5"}));
        assertThrows(IllegalArgumentException.class, () -> AsyncClientBench.parseArgs(new String[]{"--ops"}));
        assertThrows(IllegalArgumentException.class, () -> AsyncClientBench.parseArgs(List.of("ops").toArray(new String[0])));
    }

    @Test
    void percentile_interpolates_between_samples() {
        assertEquals(1.5, AsyncClientBench.percentile(List.of(1.0, 2.0), 0.5), 1e-9);
        assertTrue(Double.isNaN(AsyncClientBench.percentile(List.of(), 0.5)));
    }
}
