// file: src/main/java/io/kvbridge/client/AsyncClient.java
package io.kvbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.command.Arguments;
import io.kvbridge.client.command.Command;
import io.kvbridge.client.command.CommandRegistry;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.dispatch.Callback;
import io.kvbridge.client.dispatch.Dispatcher;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.client.dispatch.EventLoop;
import io.kvbridge.client.dispatch.FaultHandler;
import io.kvbridge.client.dispatch.WorkerPool;
import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.storage.StoreHandle;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Callback-driven facade over a blocking {@link StoreHandle}.
 * <p>
 * Every operation returns immediately. Its callback runs later on the event
 * loop, exactly once, with the error object first; a code of 0 means success.
 * Parameter errors, store errors and "client closed" all travel the same way.
 * <p>
 * Arguments are Jackson trees: keys as {ns, set, key} or [ns, set, key],
 * bins as {name: value}, metadata as {ttl, gen}, policies as objects whose
 * option names match the policy record fields. A null policy or metadata
 * argument means "use the default".
 * <p>
 * Threading:
 *  - Operations may be issued from any thread, including from inside a callback.
 *  - Callbacks of one client never run concurrently with each other.
 *  - No ordering between distinct operations; chain callbacks when order matters.
 */
public final class AsyncClient implements AutoCloseable {
    private static final Logger log = Logger.getLogger(AsyncClient.class.getName());

    // Held so the configured level is not lost when the logger would otherwise be collected.
    private static final Logger PACKAGE_LOGGER = Logger.getLogger("io.kvbridge");

    private final StoreHandle store;
    private final boolean ownsStore;
    private final WorkerPool workers;
    private final EventLoop loop;
    private final Dispatcher dispatcher;
    private final Policies defaults;
    private final Duration shutdownTimeout;
    private final AtomicLong ids = new AtomicLong();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public AsyncClient(StoreHandle store) {
        this(store, ClientConfig.DEFAULT);
    }

    public AsyncClient(StoreHandle store, ClientConfig config) {
        this(store, config, EventLoop.shared(), FaultHandler.logging(), true);
    }

    /**
     * @param loop      scheduler that runs callbacks; the client never closes it
     * @param faults    receives exceptions thrown by callbacks
     * @param ownsStore whether {@link #close()} also closes {@code store}
     */
    public AsyncClient(StoreHandle store, ClientConfig config, EventLoop loop, FaultHandler faults, boolean ownsStore) {
        this.store = Objects.requireNonNull(store, "store");
        Objects.requireNonNull(config, "config");
        this.ownsStore = ownsStore;
        this.loop = Objects.requireNonNull(loop, "loop");
        this.workers = config.workerThreads() == 0
                ? WorkerPool.shared()
                : new WorkerPool("kvbridge-worker", config.workerThreads(), config.workerQueueCapacity());
        this.dispatcher = new Dispatcher(workers, loop, Objects.requireNonNull(faults, "faults"));
        this.defaults = config.policies();
        this.shutdownTimeout = config.shutdownTimeout();
        if (config.logLevel() != null) {
            PACKAGE_LOGGER.setLevel(config.logLevel());
        }
        log.log(Level.INFO, "client opened (workers={0}, shared={1}, hosts={2})",
                new Object[]{workers.threads(), workers.isShared(), config.hosts().size()});
    }

    // ---------- single-record operations ----------

    public void get(JsonNode key, RecordCallback cb) {
        get(key, null, cb);
    }

    public void get(JsonNode key, JsonNode policy, RecordCallback cb) {
        submit(CommandRegistry.GET, record(cb), key, policy);
    }

    public void select(JsonNode key, JsonNode bins, RecordCallback cb) {
        select(key, bins, null, cb);
    }

    public void select(JsonNode key, JsonNode bins, JsonNode policy, RecordCallback cb) {
        submit(CommandRegistry.SELECT, record(cb), key, bins, policy);
    }

    public void exists(JsonNode key, MetaCallback cb) {
        exists(key, null, cb);
    }

    public void exists(JsonNode key, JsonNode policy, MetaCallback cb) {
        submit(CommandRegistry.EXISTS, meta(cb), key, policy);
    }

    public void put(JsonNode key, JsonNode bins, MetaCallback cb) {
        put(key, bins, null, null, cb);
    }

    public void put(JsonNode key, JsonNode bins, JsonNode meta, JsonNode policy, MetaCallback cb) {
        submit(CommandRegistry.PUT, meta(cb), key, bins, meta, policy);
    }

    public void remove(JsonNode key, KeyCallback cb) {
        remove(key, null, cb);
    }

    public void remove(JsonNode key, JsonNode policy, KeyCallback cb) {
        Objects.requireNonNull(cb, "callback");
        submit(CommandRegistry.REMOVE, argv -> cb.onKey(argv[0], argv[1]), key, policy);
    }

    public void operate(JsonNode key, JsonNode operations, RecordCallback cb) {
        operate(key, operations, null, null, cb);
    }

    public void operate(JsonNode key, JsonNode operations, JsonNode meta, JsonNode policy, RecordCallback cb) {
        submit(CommandRegistry.OPERATE, record(cb), key, operations, meta, policy);
    }

    // ---------- batch operations ----------

    public void batchGet(JsonNode keys, BatchCallback cb) {
        batchGet(keys, null, cb);
    }

    public void batchGet(JsonNode keys, JsonNode policy, BatchCallback cb) {
        submit(CommandRegistry.BATCH_GET, batch(cb), keys, policy);
    }

    public void batchExists(JsonNode keys, BatchCallback cb) {
        batchExists(keys, null, cb);
    }

    public void batchExists(JsonNode keys, JsonNode policy, BatchCallback cb) {
        submit(CommandRegistry.BATCH_EXISTS, batch(cb), keys, policy);
    }

    public void batchSelect(JsonNode keys, JsonNode bins, BatchCallback cb) {
        batchSelect(keys, bins, null, cb);
    }

    public void batchSelect(JsonNode keys, JsonNode bins, JsonNode policy, BatchCallback cb) {
        submit(CommandRegistry.BATCH_SELECT, batch(cb), keys, bins, policy);
    }

    /**
     * Positional entry point: {@code command} is one of
     * {@link CommandRegistry#names()}, {@code args} are the arguments in the
     * order of the typed method, callback excluded. An unknown command is
     * reported as PARAM through the callback.
     */
    public void invoke(String command, List<JsonNode> args, Callback callback) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(callback, "callback");
        submit(CommandRegistry.lookup(command), callback, new Arguments(args));
    }

    // ---------- state ----------

    /** Operations issued and not yet completed. */
    public int inFlight() {
        return dispatcher.inFlight();
    }

    public EventLoop eventLoop() {
        return loop;
    }

    public boolean isOpen() {
        return open.get();
    }

    /**
     * Stop accepting operations, wait up to the configured shutdown timeout for
     * in-flight ones, then release the private worker pool and the store.
     * Operations issued afterwards complete with a CLIENT error.
     * When called from a callback it does not wait, since the callbacks it
     * would wait for run on the same thread.
     */
    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        if (!loop.inLoop()) {
            awaitDrained();
        }
        workers.close(shutdownTimeout);
        if (ownsStore) {
            store.close();
        }
        log.log(Level.INFO, "client closed ({0} operations still in flight)", dispatcher.inFlight());
    }

    // ---------- internals ----------

    private void submit(Command command, Callback callback, JsonNode... args) {
        submit(command, callback, Arguments.of(args));
    }

    private void submit(Command command, Callback callback, Arguments args) {
        Envelope env = new Envelope(ids.incrementAndGet(), command, store, callback);
        if (!open.get()) {
            env.fail(ErrorCode.CLIENT, "client is closed");
        } else {
            try {
                command.prepare(args, env, defaults);
            } catch (ParameterException e) {
                env.fail(Conversions.paramError(e));
            } catch (RuntimeException | StackOverflowError e) {
                log.log(Level.WARNING, "could not prepare " + env, e);
                env.fail(ErrorCode.PARAM, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        if (log.isLoggable(Level.FINE)) {
            log.log(Level.FINE, "dispatch {0} keys={1}", new Object[]{env, env.keys()});
        }
        dispatcher.dispatch(env);
    }

    private void awaitDrained() {
        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        while (dispatcher.inFlight() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        if (dispatcher.inFlight() > 0) {
            log.log(Level.WARNING, "close timed out with {0} operations in flight", dispatcher.inFlight());
        }
    }

    private static Callback record(RecordCallback cb) {
        Objects.requireNonNull(cb, "callback");
        return argv -> cb.onRecord(argv[0], argv[1], argv[2], argv[3]);
    }

    private static Callback meta(MetaCallback cb) {
        Objects.requireNonNull(cb, "callback");
        return argv -> cb.onMeta(argv[0], argv[1], argv[2]);
    }

    private static Callback batch(BatchCallback cb) {
        Objects.requireNonNull(cb, "callback");
        return argv -> cb.onBatch(argv[0], argv[1]);
    }

    @Override
    public String toString() {
        return "AsyncClient[store=" + store + ", open=" + open.get() + ", inFlight=" + inFlight() + "]";
    }
}
