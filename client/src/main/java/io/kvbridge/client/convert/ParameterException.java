// file: src/main/java/io/kvbridge/client/convert/ParameterException.java
package io.kvbridge.client.convert;

/**
 * Malformed dynamic input: bad key shape, oversized bin name, unsupported
 * value type, wrong policy option type.
 * <p>
 * Parse sites record it in the envelope's error slot; it never reaches the
 * caller of an operation.
 */
public class ParameterException extends Exception {

    public ParameterException(String message) {
        super(message);
    }

    public ParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
