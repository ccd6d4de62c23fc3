// file: src/test/java/io/kvbridge/storage/MemoryStoreTest.java
package io.kvbridge.storage;

import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.Key;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.StoreRecord;
import io.kvbridge.core.Value;
import io.kvbridge.core.policy.CommitLevel;
import io.kvbridge.core.policy.ExistsPolicy;
import io.kvbridge.core.policy.GenerationPolicy;
import io.kvbridge.core.policy.KeyPolicy;
import io.kvbridge.core.policy.ReadPolicy;
import io.kvbridge.core.policy.RemovePolicy;
import io.kvbridge.core.policy.RetryPolicy;
import io.kvbridge.core.policy.WritePolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Single-record semantics of the in-process store: merge, exists and
 * generation policies, TTL handling, key policy, close.
 */
class MemoryStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final MemoryStore store = new MemoryStore(clock);
    private final Key key = Key.of("test", "demo", "k1");

    private static WritePolicy write(ExistsPolicy exists, GenerationPolicy gen) {
        return new WritePolicy(0, gen, KeyPolicy.DIGEST, exists, CommitLevel.ALL, RetryPolicy.NONE);
    }

    private static StoreRecord bins(Object... kv) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object v = kv[i + 1];
            out.put((String) kv[i], v == null ? Value.nil()
                    : v instanceof Long l ? Value.of(l) : Value.of((String) v));
        }
        return StoreRecord.of(out);
    }

    private static ErrorCode codeOf(Runnable r) {
        return assertThrows(StoreException.class, r::run).code();
    }

    @Test
    void put_then_get_returns_bins_and_first_generation() {
        RecordMeta meta = store.put(WritePolicy.DEFAULT, key, bins("a", 1L, "b", "x"));
        assertEquals(1, meta.generation());
        assertEquals(RecordMeta.TTL_NEVER_EXPIRE, meta.ttl());

        StoreRecord got = store.get(ReadPolicy.DEFAULT, key);
        assertEquals(Value.of(1L), got.bin("a"));
        assertEquals(Value.of("x"), got.bin("b"));
        assertEquals(1, got.generation());
    }

    @Test
    void second_put_merges_bins_and_bumps_generation() {
        store.put(WritePolicy.DEFAULT, key, bins("a", 1L, "b", "x"));
        RecordMeta meta = store.put(WritePolicy.DEFAULT, key, bins("b", "y", "c", 3L));

        assertEquals(2, meta.generation());
        StoreRecord got = store.get(ReadPolicy.DEFAULT, key);
        assertEquals(List.of("a", "b", "c"), List.copyOf(got.bins().keySet()));
        assertEquals(Value.of("y"), got.bin("b"));
    }

    @Test
    void null_bin_deletes_it_and_empty_record_disappears() {
        store.put(WritePolicy.DEFAULT, key, bins("a", 1L, "b", 2L));
        store.put(WritePolicy.DEFAULT, key, bins("a", null));
        assertNull(store.get(ReadPolicy.DEFAULT, key).bin("a"));

        store.put(WritePolicy.DEFAULT, key, bins("b", null));
        assertEquals(ErrorCode.RECORD_NOT_FOUND, codeOf(() -> store.get(ReadPolicy.DEFAULT, key)));
        assertEquals(0, store.size());
    }

    @Test
    void null_only_put_on_absent_record_is_not_found_and_creates_nothing() {
        assertEquals(ErrorCode.RECORD_NOT_FOUND, codeOf(() -> store.put(WritePolicy.DEFAULT, key, bins("a", null))));
        assertEquals(0, store.size());
        assertEquals(ErrorCode.RECORD_NOT_FOUND, codeOf(() -> store.exists(ReadPolicy.DEFAULT, key)));
    }

    @Test
    void exists_policies_are_enforced() {
        assertEquals(ErrorCode.RECORD_NOT_FOUND,
                codeOf(() -> store.put(write(ExistsPolicy.UPDATE, GenerationPolicy.IGNORE), key, bins("a", 1L))));

        store.put(write(ExistsPolicy.CREATE, GenerationPolicy.IGNORE), key, bins("a", 1L, "b", 2L));
        assertEquals(ErrorCode.RECORD_EXISTS,
                codeOf(() -> store.put(write(ExistsPolicy.CREATE, GenerationPolicy.IGNORE), key, bins("a", 1L))));

        store.put(write(ExistsPolicy.REPLACE, GenerationPolicy.IGNORE), key, bins("c", 3L));
        StoreRecord got = store.get(ReadPolicy.DEFAULT, key);
        assertEquals(Map.of("c", Value.of(3L)), got.bins());
    }

    @Test
    void generation_eq_rejects_stale_writers() {
        store.put(WritePolicy.DEFAULT, key, bins("a", 1L));
        store.put(WritePolicy.DEFAULT, key, bins("a", 2L));

        StoreRecord stale = new StoreRecord(bins("a", 9L).bins(), new RecordMeta(1, RecordMeta.TTL_NO_CHANGE));
        assertEquals(ErrorCode.GENERATION,
                codeOf(() -> store.put(write(ExistsPolicy.IGNORE, GenerationPolicy.EQ), key, stale)));

        StoreRecord fresh = new StoreRecord(bins("a", 9L).bins(), new RecordMeta(2, RecordMeta.TTL_NO_CHANGE));
        assertEquals(3, store.put(write(ExistsPolicy.IGNORE, GenerationPolicy.EQ), key, fresh).generation());
    }

    @Test
    void ttl_expires_records_and_minus_one_keeps_expiry() {
        StoreRecord withTtl = new StoreRecord(bins("a", 1L).bins(), new RecordMeta(0, 100));
        RecordMeta meta = store.put(WritePolicy.DEFAULT, key, withTtl);
        assertEquals(100, meta.ttl());

        clock.advance(Duration.ofSeconds(40));
        RecordMeta kept = store.put(WritePolicy.DEFAULT, key, bins("b", 2L));
        assertEquals(60, kept.ttl());

        clock.advance(Duration.ofSeconds(60));
        assertEquals(ErrorCode.RECORD_NOT_FOUND, codeOf(() -> store.exists(ReadPolicy.DEFAULT, key)));
    }

    @Test
    void select_returns_only_present_requested_bins() {
        store.put(WritePolicy.DEFAULT, key, bins("a", 1L, "b", 2L));
        StoreRecord got = store.select(ReadPolicy.DEFAULT, key, List.of("b", "zzz"));
        assertEquals(Map.of("b", Value.of(2L)), got.bins());
    }

    @Test
    void remove_honours_expected_generation() {
        store.put(WritePolicy.DEFAULT, key, bins("a", 1L));
        var wrongGen = new RemovePolicy(0, GenerationPolicy.EQ, 5, KeyPolicy.DIGEST, RetryPolicy.NONE);
        assertEquals(ErrorCode.GENERATION, codeOf(() -> store.remove(wrongGen, key)));

        store.remove(RemovePolicy.DEFAULT, key);
        assertEquals(ErrorCode.RECORD_NOT_FOUND, codeOf(() -> store.remove(RemovePolicy.DEFAULT, key)));
    }

    @Test
    void send_key_policy_stores_the_user_key() {
        var send = new WritePolicy(0, GenerationPolicy.IGNORE, KeyPolicy.SEND,
                ExistsPolicy.IGNORE, CommitLevel.ALL, RetryPolicy.NONE);
        store.put(WritePolicy.DEFAULT, key, bins("a", 1L));
        assertNull(store.storedKey(key));

        store.put(send, key, bins("a", 2L));
        assertEquals(key, store.storedKey(key));
    }

    @Test
    void oversized_record_is_rejected() {
        var small = new MemoryStore(clock, Duration.ZERO, 16);
        assertEquals(ErrorCode.RECORD_TOO_BIG,
                codeOf(() -> small.put(WritePolicy.DEFAULT, key, bins("a", "x".repeat(64)))));
    }

    @Test
    void simulated_latency_beyond_timeout_reports_timeout() {
        var slow = new MemoryStore(clock, Duration.ofMillis(200), MemoryStore.DEFAULT_MAX_RECORD_BYTES);
        var tight = new ReadPolicy(20, KeyPolicy.DIGEST, RetryPolicy.NONE);
        assertEquals(ErrorCode.TIMEOUT, codeOf(() -> slow.get(tight, key)));
    }

    @Test
    void closed_store_fails_with_connection_error() {
        store.close();
        assertEquals(ErrorCode.CONNECTION, codeOf(() -> store.get(ReadPolicy.DEFAULT, key)));
        assertEquals(1, store.calls());
    }
}
