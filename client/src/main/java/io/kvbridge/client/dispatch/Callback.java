// file: src/main/java/io/kvbridge/client/dispatch/Callback.java
package io.kvbridge.client.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Completion callback in its raw, positional form.
 * <p>
 * argv[0] is always the error object {code, message, file, line}; the rest
 * depends on the command. Invoked exactly once, on the event loop thread.
 * Anything it throws is handed to the client's {@link FaultHandler}.
 */
@FunctionalInterface
public interface Callback {
    void call(JsonNode[] argv) throws Exception;
}
