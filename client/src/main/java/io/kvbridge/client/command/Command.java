// file: src/main/java/io/kvbridge/client/command/Command.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.storage.StoreHandle;

/**
 * The operation-specific part of the pipeline. Everything else (threading,
 * error routing, callback bookkeeping, release) is shared in the Dispatcher.
 * <p>
 * Threading contract:
 *  - prepare: caller thread; may read JsonNode arguments; must not block.
 *  - execute: worker thread; native structures only; exactly one store call.
 *  - respond: event loop; builds the callback arguments from the envelope.
 */
public interface Command {

    /** Name used by {@code AsyncClient.invoke} and in diagnostics. */
    String name();

    /** Number of callback arguments, error included. */
    int arity();

    /**
     * Parse positional arguments into the envelope.
     * The key is parsed first so that later failures can still report it.
     */
    void prepare(Arguments args, Envelope env, Policies defaults) throws ParameterException;

    /** Perform the blocking store call and store its outcome in the envelope. */
    void execute(StoreHandle store, Envelope env);

    /**
     * Build the callback arguments. argv[0] is the error; payload slots are
     * JSON null when the envelope carries an error.
     *
     * @throws io.kvbridge.client.convert.ConversionException when a result value
     *         has no dynamic representation
     */
    JsonNode[] respond(Envelope env);
}
