// file: src/main/java/io/kvbridge/core/StoreError.java
package io.kvbridge.core;

import java.util.Objects;

/**
 * Outcome of one store call: a code, a bounded human-readable message and the
 * source location that raised it.
 * <p>
 * {@link #ok()} is the shared success value. Every other instance is created
 * through {@link #of(ErrorCode, String)}, which records the caller's file and
 * line using {@link StackWalker}.
 */
public record StoreError(ErrorCode code, String message, String file, int line) {

    public static final int MESSAGE_MAX_LENGTH = 1024;

    private static final StoreError OK = new StoreError(ErrorCode.OK, "", "", 0);

    private static final StackWalker WALKER =
            StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    public StoreError {
        Objects.requireNonNull(code, "code");
        message = truncate(message == null ? "" : message);
        file = file == null ? "" : file;
    }

    public static StoreError ok() {
        return OK;
    }

    /**
     * Build an error attributed to the code that raised it: the first frame
     * outside this class and outside exception constructors.
     */
    public static StoreError of(ErrorCode code, String message) {
        StackWalker.StackFrame frame = WALKER.walk(frames -> frames
                .filter(f -> f.getDeclaringClass() != StoreError.class)
                .filter(f -> !Throwable.class.isAssignableFrom(f.getDeclaringClass()))
                .findFirst()
                .orElse(null));
        if (frame == null) {
            return new StoreError(code, message, "", 0);
        }
        return new StoreError(code, message, frame.getFileName(), frame.getLineNumber());
    }

    public boolean isOk() {
        return code == ErrorCode.OK;
    }

    private static String truncate(String s) {
        return s.length() <= MESSAGE_MAX_LENGTH ? s : s.substring(0, MESSAGE_MAX_LENGTH);
    }
}
