// file: src/main/java/io/kvbridge/client/dispatch/FaultHandler.java
package io.kvbridge.client.dispatch;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives exceptions thrown by user callbacks.
 * The event loop keeps running after a fault, and the envelope is released
 * after the handler returns (or throws).
 */
@FunctionalInterface
public interface FaultHandler {

    void onFault(String command, Throwable fault);

    /** Default: report as an unhandled exception at SEVERE. */
    static FaultHandler logging() {
        Logger log = Logger.getLogger(FaultHandler.class.getName());
        return (command, fault) -> log.log(Level.SEVERE, "unhandled exception in " + command + " callback", fault);
    }
}
