// file: src/main/java/io/kvbridge/storage/StoreException.java
package io.kvbridge.storage;

import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.StoreError;

import java.util.Objects;

/**
 * Failure reported by a {@link StoreHandle} call.
 * Carries a {@link StoreError} whose source location is where the store raised it.
 */
public class StoreException extends RuntimeException {

    private final transient StoreError error;

    public StoreException(StoreError error) {
        super(Objects.requireNonNull(error, "error").message());
        if (error.isOk()) {
            throw new IllegalArgumentException("StoreException requires a failure code");
        }
        this.error = error;
    }

    public StoreException(ErrorCode code, String message) {
        this(StoreError.of(code, message));
    }

    public StoreError error() {
        return error;
    }

    public ErrorCode code() {
        return error.code();
    }
}
