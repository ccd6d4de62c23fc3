// file: src/main/java/io/kvbridge/storage/StoreHandle.java
package io.kvbridge.storage;

import io.kvbridge.core.BatchRead;
import io.kvbridge.core.Key;
import io.kvbridge.core.Operation;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.StoreRecord;
import io.kvbridge.core.policy.BatchPolicy;
import io.kvbridge.core.policy.OperatePolicy;
import io.kvbridge.core.policy.ReadPolicy;
import io.kvbridge.core.policy.RemovePolicy;
import io.kvbridge.core.policy.WritePolicy;

import java.util.List;

/**
 * Blocking access to a key-value store.
 * <p>
 * Semantics:
 *  - Every call blocks the calling thread until the store answers or the
 *    policy timeout expires.
 *  - Failures are reported by throwing {@link StoreException} with the store's
 *    status code; on failure no output value exists.
 *  - Implementations are shared by many threads at once and must be thread safe.
 *  - Policies are read-only inputs; implementations never mutate them.
 */
public interface StoreHandle extends AutoCloseable {

    /** Read all bins and metadata of a record. */
    StoreRecord get(ReadPolicy policy, Key key);

    /** Read the named bins only. Bins absent from the record are omitted from the result. */
    StoreRecord select(ReadPolicy policy, Key key, List<String> bins);

    /** Read metadata only. */
    RecordMeta exists(ReadPolicy policy, Key key);

    /**
     * Write bins. {@code record.meta()} carries the expected generation (checked
     * according to {@link WritePolicy#gen()}) and the TTL to apply.
     *
     * @return metadata of the record after the write
     */
    RecordMeta put(WritePolicy policy, Key key, StoreRecord record);

    /** Delete a record. */
    void remove(RemovePolicy policy, Key key);

    /**
     * Apply all operations atomically, in order.
     *
     * @param meta expected generation and TTL for the write part
     * @return bins produced by READ operations plus the resulting metadata
     */
    StoreRecord operate(OperatePolicy policy, Key key, List<Operation> operations, RecordMeta meta);

    /**
     * Read many records in one call.
     *
     * @param bins bins to read, or null for all bins
     * @return exactly one entry per key, in the order of {@code keys}
     */
    List<BatchRead> batchGet(BatchPolicy policy, List<Key> keys, List<String> bins);

    /** Metadata-only batch read; entries carry no bins. */
    List<BatchRead> batchExists(BatchPolicy policy, List<Key> keys);

    /** Release the connection. Later calls fail with CONNECTION. */
    @Override
    void close();
}
