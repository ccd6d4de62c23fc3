// file: src/main/java/io/kvbridge/storage/MemoryStore.java
package io.kvbridge.storage;

import io.kvbridge.core.BatchRead;
import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.Key;
import io.kvbridge.core.Operation;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.StoreRecord;
import io.kvbridge.core.Value;
import io.kvbridge.core.policy.BatchPolicy;
import io.kvbridge.core.policy.ExistsPolicy;
import io.kvbridge.core.policy.GenerationPolicy;
import io.kvbridge.core.policy.KeyPolicy;
import io.kvbridge.core.policy.OperatePolicy;
import io.kvbridge.core.policy.ReadPolicy;
import io.kvbridge.core.policy.RemovePolicy;
import io.kvbridge.core.policy.RetryPolicy;
import io.kvbridge.core.policy.WritePolicy;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link StoreHandle} backed by a concurrent map.
 * <p>
 * Responsibilities:
 *  - Keep one entry per key: bins, generation, absolute expiry, optional stored user key.
 *  - Enforce write semantics: exists policy, generation check, TTL, bin merge.
 *  - Serialize access per record through striped locks; acquisition is bounded
 *    by the policy timeout and reported as TIMEOUT.
 *  - Optionally sleep before every call to imitate network latency, so the
 *    async layer can be exercised under realistic interleavings.
 * <p>
 * Expired records are treated as absent and dropped lazily on access.
 */
public final class MemoryStore implements StoreHandle {
    private static final Logger log = Logger.getLogger(MemoryStore.class.getName());

    private static final int LOCK_STRIPES = 64;
    public static final int DEFAULT_MAX_RECORD_BYTES = 1024 * 1024; // 1 MiB

    private final Map<Key, Entry> mem = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
    private final Clock clock;
    private final Duration latency;
    private final int maxRecordBytes;
    private final AtomicLong calls = new AtomicLong();
    private volatile boolean closed;

    public MemoryStore() {
        this(Clock.systemUTC(), Duration.ZERO, DEFAULT_MAX_RECORD_BYTES);
    }

    public MemoryStore(Clock clock) {
        this(clock, Duration.ZERO, DEFAULT_MAX_RECORD_BYTES);
    }

    /**
     * @param clock          time source for TTL handling
     * @param latency        simulated per-call latency (ZERO to disable)
     * @param maxRecordBytes estimated size above which writes fail with RECORD_TOO_BIG
     */
    public MemoryStore(Clock clock, Duration latency, int maxRecordBytes) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.latency = Objects.requireNonNull(latency, "latency");
        if (latency.isNegative()) throw new IllegalArgumentException("latency must be >= 0");
        if (maxRecordBytes <= 0) throw new IllegalArgumentException("maxRecordBytes must be > 0");
        this.maxRecordBytes = maxRecordBytes;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    // ---------- reads ----------

    @Override
    public StoreRecord get(ReadPolicy policy, Key key) {
        Objects.requireNonNull(policy, "policy");
        begin(policy.timeoutMillis());
        return withLock(key, policy.timeoutMillis(), policy.retry(), () -> {
            Entry e = live(key);
            if (e == null) throw notFound(key);
            return e.toRecord(e.bins, now());
        });
    }

    @Override
    public StoreRecord select(ReadPolicy policy, Key key, List<String> bins) {
        Objects.requireNonNull(policy, "policy");
        checkBinNames(bins);
        begin(policy.timeoutMillis());
        return withLock(key, policy.timeoutMillis(), policy.retry(), () -> {
            Entry e = live(key);
            if (e == null) throw notFound(key);
            return e.toRecord(pick(e.bins, bins), now());
        });
    }

    @Override
    public RecordMeta exists(ReadPolicy policy, Key key) {
        Objects.requireNonNull(policy, "policy");
        begin(policy.timeoutMillis());
        return withLock(key, policy.timeoutMillis(), policy.retry(), () -> {
            Entry e = live(key);
            if (e == null) throw notFound(key);
            return e.meta(now());
        });
    }

    // ---------- writes ----------

    @Override
    public RecordMeta put(WritePolicy policy, Key key, StoreRecord record) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(record, "record");
        begin(policy.timeoutMillis());
        return withLock(key, policy.timeoutMillis(), policy.retry(), () -> {
            Entry existing = live(key);
            checkExists(policy.exists(), existing, key);
            checkGeneration(policy.gen(), record.generation(), existing);

            boolean replace = policy.exists() == ExistsPolicy.REPLACE
                    || policy.exists() == ExistsPolicy.CREATE_OR_REPLACE;
            Map<String, Value> bins = (existing == null || replace)
                    ? new LinkedHashMap<>()
                    : new LinkedHashMap<>(existing.bins);
            for (Map.Entry<String, Value> b : record.bins().entrySet()) {
                if (b.getValue() instanceof Value.NullValue) {
                    bins.remove(b.getKey());
                } else {
                    bins.put(b.getKey(), b.getValue());
                }
            }

            if (bins.isEmpty()) {
                // Writing only nulls leaves nothing behind: the record goes away,
                // and there is nothing to delete when it was never there.
                if (existing == null) throw notFound(key);
                mem.remove(key);
                return new RecordMeta(RecordMeta.nextGeneration(existing.generation), RecordMeta.TTL_NEVER_EXPIRE);
            }
            checkSize(key, bins);

            Entry next = commit(key, existing, bins, record.ttl(), policy.key());
            return next.meta(now());
        });
    }

    @Override
    public void remove(RemovePolicy policy, Key key) {
        Objects.requireNonNull(policy, "policy");
        begin(policy.timeoutMillis());
        withLock(key, policy.timeoutMillis(), policy.retry(), () -> {
            Entry existing = live(key);
            if (existing == null) throw notFound(key);
            checkGeneration(policy.gen(), policy.generation(), existing);
            mem.remove(key);
            return null;
        });
    }

    @Override
    public StoreRecord operate(OperatePolicy policy, Key key, List<Operation> operations, RecordMeta meta) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(operations, "operations");
        Objects.requireNonNull(meta, "meta");
        if (operations.isEmpty()) {
            throw new StoreException(ErrorCode.PARAM, "operate requires at least one operation");
        }
        begin(policy.timeoutMillis());
        return withLock(key, policy.timeoutMillis(), policy.retry(), () -> {
            Entry existing = live(key);
            boolean writes = operations.stream().anyMatch(Operation::isWrite);
            boolean creates = operations.stream()
                    .anyMatch(op -> op.isWrite() && op.operator() != Operation.Operator.TOUCH);
            if (existing == null && !creates) throw notFound(key);
            if (writes) {
                checkGeneration(policy.gen(), meta.generation(), existing);
            }

            Map<String, Value> bins = existing == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existing.bins);
            Map<String, Value> reads = new LinkedHashMap<>();
            for (Operation op : operations) {
                apply(op, bins, reads);
            }

            if (!writes) {
                return existing.toRecord(reads, now());
            }
            if (bins.isEmpty()) {
                mem.remove(key);
                int gen = existing == null ? 1 : RecordMeta.nextGeneration(existing.generation);
                return new StoreRecord(reads, new RecordMeta(gen, RecordMeta.TTL_NEVER_EXPIRE));
            }
            checkSize(key, bins);
            Entry next = commit(key, existing, bins, meta.ttl(), policy.key());
            return next.toRecord(reads, now());
        });
    }

    // ---------- batch ----------

    @Override
    public List<BatchRead> batchGet(BatchPolicy policy, List<Key> keys, List<String> bins) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(keys, "keys");
        if (bins != null) checkBinNames(bins);
        begin(policy.timeoutMillis());
        List<BatchRead> out = new ArrayList<>(keys.size());
        for (Key key : keys) {
            out.add(batchOne(key, policy.timeoutMillis(), e -> e.toRecord(bins == null ? e.bins : pick(e.bins, bins), now())));
        }
        return out;
    }

    @Override
    public List<BatchRead> batchExists(BatchPolicy policy, List<Key> keys) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(keys, "keys");
        begin(policy.timeoutMillis());
        List<BatchRead> out = new ArrayList<>(keys.size());
        for (Key key : keys) {
            out.add(batchOne(key, policy.timeoutMillis(), e -> e.toRecord(Map.of(), now())));
        }
        return out;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.log(Level.INFO, "MemoryStore closed after {0} calls", calls.get());
        }
    }

    /** Number of store calls made so far, including failed ones. */
    public long calls() {
        return calls.get();
    }

    /** Number of live (unexpired) records. */
    public int size() {
        long now = now();
        return (int) mem.values().stream().filter(e -> !e.expired(now)).count();
    }

    /** Stored user key of a record written with KeyPolicy.SEND, or null. */
    public Key storedKey(Key key) {
        Entry e = live(key);
        return e == null ? null : e.storedKey;
    }

    // ---------- internals ----------

    private BatchRead batchOne(Key key, long timeoutMillis, Function<Entry, StoreRecord> read) {
        try {
            return withLock(key, timeoutMillis, RetryPolicy.NONE, () -> {
                Entry e = live(key);
                return e == null
                        ? BatchRead.failed(key, ErrorCode.RECORD_NOT_FOUND)
                        : BatchRead.found(key, read.apply(e));
            });
        } catch (StoreException ex) {
            // Per-key failure (e.g. lock timeout) does not abort the batch.
            return BatchRead.failed(key, ex.code());
        }
    }

    private void apply(Operation op, Map<String, Value> bins, Map<String, Value> reads) {
        String bin = op.binName();
        switch (op.operator()) {
            case READ -> {
                Value v = bins.get(bin);
                if (v != null) reads.put(bin, v);
            }
            case WRITE -> {
                if (op.value() instanceof Value.NullValue) {
                    bins.remove(bin);
                } else {
                    bins.put(bin, op.value());
                }
            }
            case INCR -> {
                Value current = bins.get(bin);
                long delta = ((Value.IntegerValue) op.value()).value();
                if (current == null) {
                    bins.put(bin, Value.of(delta));
                } else if (current instanceof Value.IntegerValue iv) {
                    bins.put(bin, Value.of(iv.value() + delta));
                } else {
                    throw incompatible(bin, current, op);
                }
            }
            case APPEND, PREPEND -> {
                Value current = bins.get(bin);
                String s = ((Value.StringValue) op.value()).value();
                if (current == null) {
                    bins.put(bin, Value.of(s));
                } else if (current instanceof Value.StringValue sv) {
                    String joined = op.operator() == Operation.Operator.APPEND ? sv.value() + s : s + sv.value();
                    bins.put(bin, Value.of(joined));
                } else {
                    throw incompatible(bin, current, op);
                }
            }
            case TOUCH -> {
                // generation and TTL are handled by commit()
            }
        }
    }

    private Entry commit(Key key, Entry existing, Map<String, Value> bins, long ttl, KeyPolicy keyPolicy) {
        long now = now();
        int gen = existing == null ? 1 : RecordMeta.nextGeneration(existing.generation);
        long expireAt;
        if (ttl == RecordMeta.TTL_NO_CHANGE) {
            expireAt = existing == null ? 0L : existing.expireAtMillis;
        } else if (ttl == RecordMeta.TTL_NEVER_EXPIRE) {
            expireAt = 0L;
        } else {
            expireAt = now + TimeUnit.SECONDS.toMillis(ttl);
        }
        Key stored = keyPolicy == KeyPolicy.SEND ? key : (existing == null ? null : existing.storedKey);
        Entry next = new Entry(bins, gen, expireAt, stored);
        mem.put(key, next);
        return next;
    }

    private <T> T withLock(Key key, long timeoutMillis, RetryPolicy retry, Supplier<T> body) {
        Objects.requireNonNull(key, "key");
        ReentrantLock lock = locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
        int attempts = retry == RetryPolicy.ONCE ? 2 : 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (acquire(lock, timeoutMillis)) {
                try {
                    return body.get();
                } finally {
                    lock.unlock();
                }
            }
            log.log(Level.FINE, "lock timeout on {0} (attempt {1})", new Object[]{key, attempt});
        }
        throw new StoreException(ErrorCode.TIMEOUT, "timed out after " + timeoutMillis + "ms waiting for " + key);
    }

    private static boolean acquire(ReentrantLock lock, long timeoutMillis) {
        if (timeoutMillis == 0) {
            lock.lock();
            return true;
        }
        try {
            return lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(ErrorCode.CLIENT, "interrupted while waiting for record lock");
        }
    }

    /** Common call prologue: connection check, accounting, simulated latency. */
    private void begin(long timeoutMillis) {
        calls.incrementAndGet();
        if (closed) {
            throw new StoreException(ErrorCode.CONNECTION, "store handle is closed");
        }
        if (latency.isZero()) {
            return;
        }
        long sleepMillis = latency.toMillis();
        boolean timesOut = timeoutMillis > 0 && sleepMillis > timeoutMillis;
        try {
            Thread.sleep(timesOut ? timeoutMillis : sleepMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(ErrorCode.CLIENT, "interrupted during store call");
        }
        if (timesOut) {
            throw new StoreException(ErrorCode.TIMEOUT, "store call exceeded " + timeoutMillis + "ms");
        }
    }

    private Entry live(Key key) {
        Entry e = mem.get(key);
        if (e == null) return null;
        if (e.expired(now())) {
            mem.remove(key, e);
            return null;
        }
        return e;
    }

    private long now() {
        return clock.millis();
    }

    private static void checkExists(ExistsPolicy policy, Entry existing, Key key) {
        switch (policy) {
            case CREATE -> {
                if (existing != null) throw new StoreException(ErrorCode.RECORD_EXISTS, "record exists: " + key);
            }
            case UPDATE, REPLACE -> {
                if (existing == null) throw notFound(key);
            }
            case IGNORE, CREATE_OR_REPLACE -> {
                // no requirement
            }
        }
    }

    private static void checkGeneration(GenerationPolicy policy, int expected, Entry existing) {
        if (policy == GenerationPolicy.IGNORE || existing == null) {
            return;
        }
        boolean ok = policy == GenerationPolicy.EQ
                ? expected == existing.generation
                : expected > existing.generation;
        if (!ok) {
            throw new StoreException(ErrorCode.GENERATION,
                    "generation mismatch: expected %d (%s), stored %d".formatted(expected, policy, existing.generation));
        }
    }

    private static void checkBinNames(List<String> bins) {
        Objects.requireNonNull(bins, "bins");
        try {
            bins.forEach(StoreRecord::checkBinName);
        } catch (IllegalArgumentException e) {
            throw new StoreException(ErrorCode.PARAM, e.getMessage());
        }
    }

    private void checkSize(Key key, Map<String, Value> bins) {
        long size = 0;
        for (Map.Entry<String, Value> b : bins.entrySet()) {
            size += b.getKey().length() + estimate(b.getValue());
        }
        if (size > maxRecordBytes) {
            throw new StoreException(ErrorCode.RECORD_TOO_BIG,
                    "record %s is ~%d bytes, limit %d".formatted(key, size, maxRecordBytes));
        }
    }

    private static long estimate(Value root) {
        long n = 0;
        Deque<Value> todo = new ArrayDeque<>();
        todo.push(root);
        while (!todo.isEmpty()) {
            Value v = todo.pop();
            if (v instanceof Value.StringValue s) {
                n += s.value().getBytes(StandardCharsets.UTF_8).length;
            } else if (v instanceof Value.BytesValue b) {
                n += b.length();
            } else if (v instanceof Value.ListValue l) {
                n += 4;
                l.values().forEach(todo::push);
            } else if (v instanceof Value.MapValue m) {
                n += 4;
                m.entries().forEach((k, e) -> {
                    todo.push(k);
                    todo.push(e);
                });
            } else {
                n += 8;
            }
        }
        return n;
    }

    private static Map<String, Value> pick(Map<String, Value> bins, List<String> names) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (String n : names) {
            Value v = bins.get(n);
            if (v != null) out.put(n, v);
        }
        return out;
    }

    private static StoreException notFound(Key key) {
        return new StoreException(ErrorCode.RECORD_NOT_FOUND, "record not found: " + key);
    }

    private static StoreException incompatible(String bin, Value current, Operation op) {
        return new StoreException(ErrorCode.BIN_INCOMPATIBLE_TYPE,
                "%s on bin '%s' holding %s".formatted(op.operator(), bin, current.type()));
    }

    /** Immutable stored state of one record; replaced wholesale on every write. */
    private static final class Entry {
        final Map<String, Value> bins;
        final int generation;
        final long expireAtMillis; // 0 = never
        final Key storedKey;       // non-null only for KeyPolicy.SEND writes

        Entry(Map<String, Value> bins, int generation, long expireAtMillis, Key storedKey) {
            this.bins = Collections.unmodifiableMap(new LinkedHashMap<>(bins));
            this.generation = generation;
            this.expireAtMillis = expireAtMillis;
            this.storedKey = storedKey;
        }

        boolean expired(long now) {
            return expireAtMillis != 0 && expireAtMillis <= now;
        }

        RecordMeta meta(long now) {
            if (expireAtMillis == 0) {
                return new RecordMeta(generation, RecordMeta.TTL_NEVER_EXPIRE);
            }
            long remainingMillis = Math.max(1, expireAtMillis - now);
            return new RecordMeta(generation, (remainingMillis + 999) / 1000);
        }

        StoreRecord toRecord(Map<String, Value> bins, long now) {
            return new StoreRecord(bins, meta(now));
        }
    }
}
