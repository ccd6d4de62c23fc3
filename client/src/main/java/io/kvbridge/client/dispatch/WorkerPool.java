// file: src/main/java/io/kvbridge/client/dispatch/WorkerPool.java
package io.kvbridge.client.dispatch;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of daemon threads that run blocking store calls.
 * <p>
 * One pool is shared by every client in the process ({@link #shared()}),
 * sized by the system property {@code kvbridge.workerThreads} (default 4).
 * Clients and tests may also create private pools.
 * <p>
 * The work queue is bounded; a full queue rejects the task and the caller
 * completes the envelope with an error instead of blocking.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = Logger.getLogger(WorkerPool.class.getName());

    public static final int DEFAULT_THREADS = 4;
    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private static WorkerPool shared;

    private final ThreadPoolExecutor executor;
    private final String name;

    public WorkerPool(int threads, int queueCapacity) {
        this("kvbridge-worker", threads, queueCapacity);
    }

    public WorkerPool(String name, int threads, int queueCapacity) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
        this.name = name;
        AtomicInteger seq = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
        log.log(Level.INFO, "worker pool {0} started with {1} threads", new Object[]{name, threads});
    }

    /** Process-wide pool, created on first use. */
    public static synchronized WorkerPool shared() {
        if (shared == null) {
            int threads = Integer.getInteger("kvbridge.workerThreads", DEFAULT_THREADS);
            shared = new WorkerPool("kvbridge-shared-worker", threads, DEFAULT_QUEUE_CAPACITY);
        }
        return shared;
    }

    /**
     * Run a task on one of the pool threads.
     *
     * @throws RejectedExecutionException if the queue is full or the pool is closed
     */
    public void execute(Runnable task) {
        executor.execute(task);
    }

    public int threads() {
        return executor.getCorePoolSize();
    }

    public int queued() {
        return executor.getQueue().size();
    }

    public boolean isShared() {
        synchronized (WorkerPool.class) {
            return this == shared;
        }
    }

    /** Closing the shared pool is a no-op; it lives as long as the process. */
    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    public void close(Duration timeout) {
        if (isShared()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.log(Level.WARNING, "worker pool {0} still busy after {1}", new Object[]{name, timeout});
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
