package com.questrail.wsclient.internal.loop;

import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ClientObservabilitySink;
import com.questrail.wsclient.observability.ConnectionEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * IoLoopRunner
 * =============================================================================
 * Production {@link IoLoop} backed by a single-threaded
 * {@link ScheduledThreadPoolExecutor}.
 *
 * <h2>Design</h2>
 * <p>Each {@link #start()} creates a fresh executor with exactly one thread. An
 * executor thread waits for work instead of exiting, so the loop stays alive
 * while the client is idle between a failed attempt and the next one. Each
 * {@link #stop()} shuts that executor down, drops delayed tasks that have not
 * fired yet, and joins the thread. A stopped runner can be started again.</p>
 *
 * <h2>Failure containment</h2>
 * <p>A task that throws is reported through the observability sink; it never
 * terminates the loop thread.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are safe to call from any thread.</p>
 */
public final class IoLoopRunner implements IoLoop {

    private final ThreadFactory threadFactory;
    private final Duration shutdownTimeout;
    private final ClientObservabilitySink observabilitySink;

    private volatile ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    /**
     * @param threadFactory     creates the loop thread on each start
     * @param shutdownTimeout   how long {@link #stop()} waits before forcing the thread down
     * @param observabilitySink receives task failures and loop exit notices
     */
    public IoLoopRunner(ThreadFactory threadFactory,
                        Duration shutdownTimeout,
                        ClientObservabilitySink observabilitySink) {
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    @Override
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        ScheduledThreadPoolExecutor created = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = threadFactory.newThread(() -> {
                try {
                    runnable.run();
                } finally {
                    if (loopThread == Thread.currentThread()) {
                        loopThread = null;
                    }
                    observabilitySink.onConnectionEvent(
                        ConnectionEvent.of(ConnectionEvent.Kind.LOOP_EXITED, Thread.currentThread().getName()));
                }
            });
            loopThread = thread;
            return thread;
        });
        created.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        created.setRemoveOnCancelPolicy(true);
        created.prestartCoreThread();
        executor = created;
    }

    @Override
    public void stop() {
        final ScheduledThreadPoolExecutor retired;
        final Thread exiting;
        synchronized (this) {
            retired = executor;
            exiting = loopThread;
            executor = null;
        }
        if (retired == null) {
            return;
        }

        retired.shutdown();
        if (Thread.currentThread() == exiting) {
            // Cannot join ourselves; the thread exits once the current task returns.
            return;
        }

        try {
            if (!retired.awaitTermination(shutdownTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                retired.shutdownNow();
                observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.LOOP_FAILURE,
                    "I/O loop did not finish within " + shutdownTimeout + "; interrupted", null));
            } else if (exiting != null) {
                // Terminated executors still have their worker unwinding.
                exiting.join(Math.max(1, shutdownTimeout.toMillis()));
            }
        } catch (InterruptedException e) {
            retired.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return executor != null;
    }

    @Override
    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        ScheduledThreadPoolExecutor current = executor;
        if (current == null) {
            return;
        }
        try {
            current.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            // Lost a race with stop(); the task is discarded like any task submitted while stopped.
        }
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        ScheduledThreadPoolExecutor current = executor;
        if (current == null) {
            return Cancellable.NONE;
        }
        try {
            ScheduledFuture<?> future = current.schedule(guarded(task), delay.toNanos(), TimeUnit.NANOSECONDS);
            return new ScheduledFutureCancellable(future);
        } catch (RejectedExecutionException e) {
            return Cancellable.NONE;
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.LOOP_FAILURE,
                    "Unhandled exception in I/O loop task", e));
            }
        };
    }

    /**
     * Adapter from {@link ScheduledFuture} to {@link Cancellable}.
     */
    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // mayInterruptIfRunning=false: a running timer callback finishes normally
            return future.cancel(false);
        }
    }
}
