// file: src/main/java/io/kvbridge/client/dispatch/Envelope.java
package io.kvbridge.client.dispatch;

import io.kvbridge.client.command.Command;
import io.kvbridge.core.BatchRead;
import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.Key;
import io.kvbridge.core.Operation;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.StoreError;
import io.kvbridge.core.StoreRecord;
import io.kvbridge.storage.StoreHandle;

import java.util.List;
import java.util.Objects;

/**
 * Per-call context carried across the async boundary.
 * <p>
 * Lifecycle (strictly sequential, one thread at a time):
 *  1) PREPARED  - filled on the caller thread from dynamic input.
 *  2) EXECUTED  - the worker thread stored the store call's outcome.
 *  3) RELEASED  - the event loop invoked the callback and cleared every slot.
 * <p>
 * Hand-offs between the three threads go through an executor queue and the
 * event loop queue, which order all writes of one stage before the reads of
 * the next. Fields therefore need no extra synchronization.
 * <p>
 * Ownership:
 *  - the store handle is borrowed from the client and never closed here;
 *  - every other slot belongs to the envelope and is dropped by {@link #release()};
 *  - the callback can be taken exactly once.
 * <p>
 * Only native structures live here. JsonNode values never enter an envelope,
 * so the worker thread cannot touch caller-owned dynamic objects.
 */
public final class Envelope {

    public enum State { PREPARED, EXECUTED, RELEASED }

    private final long id;
    private final Command command;
    private final StoreHandle store;
    private Callback callback;
    private State state = State.PREPARED;

    private StoreError error = StoreError.ok();

    // request
    private List<Key> keys = List.of();
    private List<String> bins;
    private List<Operation> operations;
    private StoreRecord request;
    private RecordMeta requestMeta = RecordMeta.NONE;
    private Object policy;

    // response
    private StoreRecord result;
    private RecordMeta resultMeta;
    private List<BatchRead> batch;

    public Envelope(long id, Command command, StoreHandle store, Callback callback) {
        this.id = id;
        this.command = Objects.requireNonNull(command, "command");
        this.store = Objects.requireNonNull(store, "store");
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    public long id() { return id; }

    public Command command() { return command; }

    public StoreHandle store() {
        ensureLive();
        return store;
    }

    public State state() { return state; }

    // ---------- error slot ----------

    public StoreError error() { return error; }

    /** Record a failure. The first failure wins; later ones are dropped. */
    public void fail(StoreError failure) {
        Objects.requireNonNull(failure, "failure");
        if (failure.isOk()) {
            throw new IllegalArgumentException("fail() requires a failure code");
        }
        if (error.isOk()) {
            error = failure;
        }
    }

    public void fail(ErrorCode code, String message) {
        fail(StoreError.of(code, message));
    }

    /** Replace whatever error is present; used when response conversion fails. */
    public void overrideError(StoreError failure) {
        this.error = Objects.requireNonNull(failure, "failure");
    }

    public boolean ok() { return error.isOk(); }

    // ---------- request slots ----------

    public List<Key> keys() { return keys; }

    /** Single-key commands: the one key, or null when the key failed to parse. */
    public Key key() { return keys.isEmpty() ? null : keys.get(0); }

    public void key(Key key) { this.keys = List.of(Objects.requireNonNull(key, "key")); }

    public void keys(List<Key> keys) { this.keys = List.copyOf(keys); }

    public List<String> bins() { return bins; }

    public void bins(List<String> bins) { this.bins = bins == null ? null : List.copyOf(bins); }

    public List<Operation> operations() { return operations; }

    public void operations(List<Operation> operations) { this.operations = List.copyOf(operations); }

    public StoreRecord request() { return request; }

    public void request(StoreRecord request) { this.request = request; }

    public RecordMeta requestMeta() { return requestMeta; }

    public void requestMeta(RecordMeta meta) { this.requestMeta = Objects.requireNonNull(meta, "meta"); }

    public <P> P policy(Class<P> type) { return type.cast(policy); }

    public void policy(Object policy) { this.policy = Objects.requireNonNull(policy, "policy"); }

    // ---------- response slots ----------

    public StoreRecord result() { return result; }

    public void result(StoreRecord result) { this.result = result; }

    public RecordMeta resultMeta() { return resultMeta; }

    public void resultMeta(RecordMeta meta) { this.resultMeta = meta; }

    public List<BatchRead> batch() { return batch; }

    public void batch(List<BatchRead> batch) { this.batch = batch == null ? null : List.copyOf(batch); }

    // ---------- lifecycle ----------

    void markExecuted() {
        ensureLive();
        state = State.EXECUTED;
    }

    /**
     * Hand out the retained callback. Exactly one caller can get it; the
     * envelope forgets it at the same time.
     */
    Callback takeCallback() {
        ensureLive();
        Callback cb = callback;
        if (cb == null) {
            throw new IllegalStateException("callback of envelope " + id + " already taken");
        }
        callback = null;
        return cb;
    }

    /** Drop every owned slot. Calling it twice is a bug in the pipeline. */
    void release() {
        ensureLive();
        state = State.RELEASED;
        callback = null;
        keys = List.of();
        bins = null;
        operations = null;
        request = null;
        requestMeta = RecordMeta.NONE;
        policy = null;
        result = null;
        resultMeta = null;
        batch = null;
    }

    private void ensureLive() {
        if (state == State.RELEASED) {
            throw new IllegalStateException("envelope " + id + " already released");
        }
    }

    @Override
    public String toString() {
        return "Envelope[" + id + ", " + command.name() + ", " + state + ", " + error.code() + "]";
    }
}
