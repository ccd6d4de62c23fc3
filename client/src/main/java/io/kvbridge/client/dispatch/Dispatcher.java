// file: src/main/java/io/kvbridge/client/dispatch/Dispatcher.java
package io.kvbridge.client.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.kvbridge.client.convert.ConversionException;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.StoreError;
import io.kvbridge.storage.StoreException;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generic three-stage pipeline shared by every command.
 * <p>
 *   prepare (caller thread, done by the client before {@link #dispatch})
 *     -> execute (worker thread: one blocking store call)
 *     -> respond (event loop: convert, invoke callback once, release)
 * <p>
 * Guarantees:
 *  - Every dispatched envelope reaches respond exactly once, including when
 *    prepare already failed or the worker queue is full.
 *  - An envelope that carries an error before execute never touches the store.
 *  - Anything thrown by the store call, Errors included, fails the envelope.
 *  - A result that cannot be turned into callback arguments becomes an error
 *    with null payloads; the callback still fires.
 *  - Everything a callback throws goes to the {@link FaultHandler}; release
 *    still happens and the event loop keeps running.
 */
public final class Dispatcher {
    private static final Logger log = Logger.getLogger(Dispatcher.class.getName());

    private final WorkerPool workers;
    private final EventLoop loop;
    private final FaultHandler faults;
    private final AtomicInteger inFlight = new AtomicInteger();

    public Dispatcher(WorkerPool workers, EventLoop loop, FaultHandler faults) {
        this.workers = Objects.requireNonNull(workers, "workers");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.faults = Objects.requireNonNull(faults, "faults");
    }

    /** Hand a prepared envelope to the worker pool. Returns immediately. */
    public void dispatch(Envelope env) {
        inFlight.incrementAndGet();
        try {
            workers.execute(() -> execute(env));
        } catch (RejectedExecutionException e) {
            log.log(Level.WARNING, "worker pool rejected {0}", env);
            env.fail(ErrorCode.CLIENT, "worker queue full or closed");
            env.markExecuted();
            schedule(env);
        }
    }

    /** Envelopes dispatched and not yet released. */
    public int inFlight() {
        return inFlight.get();
    }

    public EventLoop loop() {
        return loop;
    }

    // ---------- stages ----------

    void execute(Envelope env) {
        try {
            if (env.ok()) {
                env.command().execute(env.store(), env);
            }
        } catch (StoreException e) {
            env.fail(e.error());
        } catch (Throwable t) {
            log.log(Level.WARNING, "store call failed unexpectedly for " + env, t);
            env.fail(ErrorCode.CLIENT, t.getClass().getSimpleName() + ": " + t.getMessage());
        } finally {
            env.markExecuted();
            schedule(env);
        }
    }

    void respond(Envelope env) {
        try {
            JsonNode[] argv = arguments(env);
            Callback cb = env.takeCallback();
            try {
                cb.call(argv);
            } catch (Throwable t) {
                faults.onFault(env.command().name(), t);
            }
        } finally {
            env.release();
            inFlight.decrementAndGet();
        }
    }

    private JsonNode[] arguments(Envelope env) {
        try {
            return env.command().respond(env);
        } catch (ConversionException e) {
            env.overrideError(StoreError.of(ErrorCode.PARAM, e.getMessage()));
        } catch (RuntimeException | StackOverflowError e) {
            log.log(Level.WARNING, "could not build callback arguments for " + env, e);
            env.overrideError(StoreError.of(ErrorCode.CLIENT, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
        try {
            return env.command().respond(env);
        } catch (RuntimeException | StackOverflowError e) {
            log.log(Level.WARNING, "falling back to bare error arguments for " + env, e);
            return bareError(env);
        }
    }

    private static JsonNode[] bareError(Envelope env) {
        JsonNode[] argv = new JsonNode[Math.max(1, env.command().arity())];
        Arrays.fill(argv, NullNode.getInstance());
        argv[0] = Conversions.errorToJson(env.error());
        return argv;
    }

    private void schedule(Envelope env) {
        try {
            loop.post(() -> respond(env));
        } catch (RejectedExecutionException e) {
            // No loop left to run the callback on; drop the envelope so it is not leaked.
            log.log(Level.WARNING, "event loop closed, dropping completion of {0}", env);
            env.release();
            inFlight.decrementAndGet();
        }
    }
}
