package com.questrail.wsclient.internal.exec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * ReconnectDispatcher
 * =============================================================================
 * Runs reconnects off the I/O loop thread.
 *
 * <h2>Threading</h2>
 * A reconnect stops the I/O loop, which joins the loop thread. The read loop
 * that detects the fault runs on that very thread, so it hands the reconnect to
 * this dispatcher and returns without waiting.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   activate()  → an executor exists (on start)
 *   dispatch()  → task submitted, its Future kept
 *   retire()    → last task cancelled if still queued, executor shut down and
 *                 handed back so the caller can wait for it outside its locks
 * </pre>
 * Reconnects themselves never retire the dispatcher; only the caller's stop does.
 */
public final class ReconnectDispatcher {

    private final Supplier<ExecutorService> executorFactory;

    private ExecutorService executor;
    private Future<?> lastDispatch;
    private volatile Thread dispatchThread;

    /**
     * @param executorFactory creates the executor on each activation; a
     *                        single-threaded executor is expected
     */
    public ReconnectDispatcher(Supplier<ExecutorService> executorFactory) {
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
    }

    /**
     * Create the executor if none exists. Idempotent.
     */
    public synchronized void activate() {
        if (executor == null) {
            executor = executorFactory.get();
        }
    }

    /**
     * Submit a reconnect without waiting for it.
     *
     * @return {@code false} if the dispatcher is not active
     */
    public synchronized boolean dispatch(Runnable reconnect) {
        Objects.requireNonNull(reconnect, "reconnect");
        if (executor == null) {
            return false;
        }
        try {
            lastDispatch = executor.submit(() -> {
                dispatchThread = Thread.currentThread();
                try {
                    reconnect.run();
                } finally {
                    dispatchThread = null;
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    /**
     * Cancel a still-queued reconnect and shut the executor down.
     *
     * @return the retired executor, or {@code null} if the dispatcher was not active
     */
    public synchronized ExecutorService retire() {
        if (executor == null) {
            return null;
        }
        if (lastDispatch != null) {
            lastDispatch.cancel(false);
            lastDispatch = null;
        }
        ExecutorService retired = executor;
        executor = null;
        retired.shutdown();
        return retired;
    }

    public synchronized boolean isActive() {
        return executor != null;
    }

    /**
     * @return {@code true} if the calling thread is running a dispatched reconnect
     */
    public boolean inDispatchedTask() {
        return Thread.currentThread() == dispatchThread;
    }

    /**
     * Wait for a retired executor to finish its running task, forcing it down
     * after {@code timeout}.
     *
     * @return {@code true} if it terminated within the timeout
     */
    public static boolean awaitTermination(ExecutorService retired, Duration timeout) {
        if (retired == null) {
            return true;
        }
        try {
            if (retired.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                return true;
            }
            retired.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            retired.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
