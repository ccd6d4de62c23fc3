// file: src/main/java/io/kvbridge/core/ErrorCode.java
package io.kvbridge.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Status codes carried by {@link StoreError}.
 * Negative codes originate in the client, positive codes in the store.
 */
public enum ErrorCode {
    OK(0),
    CLIENT(-1),
    PARAM(-2),
    CONNECTION(-10),
    SERVER(1),
    RECORD_NOT_FOUND(2),
    GENERATION(3),
    REQUEST_INVALID(4),
    RECORD_EXISTS(5),
    BIN_EXISTS(6),
    TIMEOUT(9),
    BIN_INCOMPATIBLE_TYPE(12),
    RECORD_TOO_BIG(13),
    RECORD_BUSY(14);

    private static final Map<Integer, ErrorCode> BY_CODE = new HashMap<>();

    static {
        for (ErrorCode c : values()) {
            BY_CODE.put(c.code, c);
        }
    }

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Resolve a numeric code; unknown codes map to SERVER. */
    public static ErrorCode fromCode(int code) {
        return BY_CODE.getOrDefault(code, SERVER);
    }
}
