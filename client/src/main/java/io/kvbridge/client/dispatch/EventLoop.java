// file: src/main/java/io/kvbridge/client/dispatch/EventLoop.java
package io.kvbridge.client.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded cooperative scheduler.
 * <p>
 * Semantics:
 *  - Tasks run one at a time, in the order they were posted (FIFO).
 *  - Tasks must not block; blocking work belongs on a {@link WorkerPool}.
 *  - A task that throws, Errors included, is logged and the loop moves on.
 *  - A task posted before close() always runs; one posted after is rejected.
 *  - close() lets already-posted tasks finish, then stops the thread.
 * <p>
 * {@link #shared()} is the process-wide loop used by clients that are not
 * given one; like the shared worker pool it is never closed.
 */
public final class EventLoop implements AutoCloseable {
    private static final Logger log = Logger.getLogger(EventLoop.class.getName());

    private static final Runnable STOP = () -> { };

    private static EventLoop shared;

    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final Object gate = new Object();
    private boolean accepting = true;
    private final Thread thread;

    public EventLoop() {
        this("kvbridge-event-loop");
    }

    public EventLoop(String threadName) {
        this.thread = new Thread(this::run, Objects.requireNonNull(threadName, "threadName"));
        this.thread.setDaemon(true);
        this.thread.start();
    }

    /** Process-wide loop, created on first use. */
    public static synchronized EventLoop shared() {
        if (shared == null) {
            shared = new EventLoop("kvbridge-shared-event-loop");
        }
        return shared;
    }

    public boolean isShared() {
        synchronized (EventLoop.class) {
            return this == shared;
        }
    }

    /**
     * Queue a task for the loop thread.
     *
     * @throws RejectedExecutionException if the loop is closed
     */
    public void post(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (gate) {
            if (!accepting) {
                throw new RejectedExecutionException("event loop is closed");
            }
            queue.add(task);
        }
    }

    public boolean isAccepting() {
        synchronized (gate) {
            return accepting;
        }
    }

    /** True when called from the loop thread itself. */
    public boolean inLoop() {
        return Thread.currentThread() == thread;
    }

    /** Number of tasks waiting to run. */
    public int pending() {
        return queue.size();
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    /**
     * Stop accepting tasks, drain the queue, and wait up to {@code timeout} for the thread.
     * No-op for the shared loop.
     */
    public void close(Duration timeout) {
        if (isShared() || !stopAccepting()) {
            return;
        }
        if (inLoop()) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.log(Level.WARNING, "event loop {0} did not stop within {1}", new Object[]{thread.getName(), timeout});
        }
    }

    /** Flip to closed and enqueue the stop marker behind every accepted task. */
    private boolean stopAccepting() {
        synchronized (gate) {
            if (!accepting) {
                return false;
            }
            accepting = false;
            queue.add(STOP);
            return true;
        }
    }

    private void run() {
        while (true) {
            Runnable task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                stopAccepting();
                log.log(Level.WARNING, "event loop interrupted, {0} tasks dropped", queue.size());
                return;
            }
            if (task == STOP) {
                return;
            }
            try {
                task.run();
            } catch (Throwable t) {
                log.log(Level.SEVERE, "event loop task failed", t);
            }
        }
    }
}
