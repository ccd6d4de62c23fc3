// file: src/main/java/io/kvbridge/core/BatchRead.java
package io.kvbridge.core;

import java.util.Objects;

/**
 * Per-key outcome of a batch call.
 * record is non-null only when status is OK; for batch-exists it carries
 * metadata and no bins.
 */
public record BatchRead(Key key, ErrorCode status, StoreRecord record) {

    public BatchRead {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(status, "status");
        if (status == ErrorCode.OK && record == null) {
            throw new IllegalArgumentException("OK batch entry requires a record");
        }
        if (status != ErrorCode.OK) {
            record = null;
        }
    }

    public static BatchRead found(Key key, StoreRecord record) {
        return new BatchRead(key, ErrorCode.OK, record);
    }

    public static BatchRead failed(Key key, ErrorCode status) {
        return new BatchRead(key, status, null);
    }
}
