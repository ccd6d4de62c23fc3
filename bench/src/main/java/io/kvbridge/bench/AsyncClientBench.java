// file: src/main/java/io/kvbridge/bench/AsyncClientBench.java
package io.kvbridge.bench;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvbridge.client.AsyncClient;
import io.kvbridge.client.ClientConfig;
import io.kvbridge.storage.MemoryStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stress and latency driver for the async pipeline, against an in-process store.
 *
 * Usage:
 *   java -cp bench.jar io.kvbridge.bench.AsyncClientBench \
 *     --ops 200000 \
 *     --concurrency 256 \
 *     --keyspace 10000 \
 *     --write-ratio 0.5 \
 *     --zipf-skew 0.99 \
 *     --latency-ms 0 \
 *     --workers 8
 *
 * At most {@code concurrency} operations are in flight at once; a new one is
 * issued as soon as a callback returns a permit. Writes are put, reads are
 * get; one op in twenty is an operate INCR on a counter bin.
 *
 * Output: one summary line to stderr.
 */
public final class AsyncClientBench {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        long ops = Long.parseLong(cfg.getOrDefault("ops", "200000"));
        int concurrency = Integer.parseInt(cfg.getOrDefault("concurrency", "256"));
        int keyspace = Integer.parseInt(cfg.getOrDefault("keyspace", "10000"));
        double writeRatio = Double.parseDouble(cfg.getOrDefault("write-ratio", "0.5"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        long latencyMs = Long.parseLong(cfg.getOrDefault("latency-ms", "0"));
        int workers = Integer.parseInt(cfg.getOrDefault("workers", "8"));

        MemoryStore store = new MemoryStore(Clock.systemUTC(), Duration.ofMillis(latencyMs), MemoryStore.DEFAULT_MAX_RECORD_BYTES);
        ClientConfig config = ClientConfig.DEFAULT.withWorkerThreads(workers);
        try (AsyncClient client = new AsyncClient(store, config)) {
            run(client, ops, concurrency, new ZipfianKeyGenerator(keyspace, zipfSkew), writeRatio);
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + a);
            }
            out.put(a.substring(2), args[++i]);
        }
        return out;
    }

    static Result run(AsyncClient client, long ops, int concurrency, ZipfianKeyGenerator keys, double writeRatio)
            throws InterruptedException {
        Semaphore permits = new Semaphore(concurrency);
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong okCount = new AtomicLong();
        AtomicLong errCount = new AtomicLong();

        long started = System.nanoTime();
        for (long i = 0; i < ops; i++) {
            permits.acquire();
            JsonNode key = key(keys.nextKey());
            long t0 = System.nanoTime();
            double roll = ThreadLocalRandom.current().nextDouble();

            if (roll < 0.05) {
                client.operate(key, incr(), (err, bins, meta, k) ->
                        complete(err, t0, latencies, okCount, errCount, permits));
            } else if (roll < writeRatio) {
                client.put(key, bins(i), (err, meta, k) ->
                        complete(err, t0, latencies, okCount, errCount, permits));
            } else {
                client.get(key, (err, bins, meta, k) ->
                        complete(err, t0, latencies, okCount, errCount, permits));
            }
        }
        if (!permits.tryAcquire(concurrency, 60, TimeUnit.SECONDS)) {
            System.err.println("timed out waiting for " + client.inFlight() + " operations");
        }
        double elapsedSeconds = (System.nanoTime() - started) / 1e9;

        List<Double> sorted = new ArrayList<>(latencies);
        Collections.sort(sorted);
        Result result = new Result(
                okCount.get(),
                errCount.get(),
                (okCount.get() + errCount.get()) / elapsedSeconds,
                percentile(sorted, 0.50),
                percentile(sorted, 0.95),
                percentile(sorted, 0.99)
        );
        System.err.printf(
                "throughput=%.2f ops/s, ok=%d, err=%d, p50=%.2fms, p95=%.2fms, p99=%.2fms%n",
                result.throughput(), result.ok(), result.errors(), result.p50(), result.p95(), result.p99()
        );
        return result;
    }

    record Result(long ok, long errors, double throughput, double p50, double p95, double p99) {
    }

    private static void complete(
            JsonNode err,
            long t0,
            ConcurrentLinkedQueue<Double> latencies,
            AtomicLong okCount,
            AtomicLong errCount,
            Semaphore permits
    ) {
        int code = err.path("code").asInt();
        // RECORD_NOT_FOUND on a cold key is an expected read outcome.
        if (code == 0 || code == 2) {
            okCount.incrementAndGet();
            latencies.add((System.nanoTime() - t0) / 1_000_000.0);
        } else {
            errCount.incrementAndGet();
        }
        permits.release();
    }

    private static JsonNode key(int id) {
        ArrayNode key = NODES.arrayNode();
        key.add("bench").add("kv").add("key-" + id);
        return key;
    }

    private static JsonNode bins(long seq) {
        ObjectNode bins = NODES.objectNode();
        bins.put("seq", seq);
        bins.put("payload", "value-" + seq);
        return bins;
    }

    private static JsonNode incr() {
        ArrayNode ops = NODES.arrayNode();
        ObjectNode op = ops.addObject();
        op.put("operation", "INCR");
        op.put("binName", "hits");
        op.put("binValue", 1);
        return ops;
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
