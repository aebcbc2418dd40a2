package com.questrail.wsclient.internal.loop;

import java.time.Duration;

/**
 * IoLoop
 * =============================================================================
 * Single-threaded, cooperative event loop that hosts connection attempts, timer
 * callbacks and read completions.
 *
 * <h2>Binding invariant</h2>
 * Tasks run one at a time, in submission order for immediate tasks and in
 * deadline order for delayed ones. Two tasks of the same loop never run
 * concurrently, so loop tasks need no mutual exclusion among themselves.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()   → a background thread exists and stays alive while idle
 *   loop.stop()    → pending delayed tasks are dropped, the thread is joined
 *   loop.start()   → usable again with a fresh thread
 * </pre>
 * Tasks submitted while the loop is stopped are discarded.
 */
public interface IoLoop
{
    /**
     * Activate the loop. Idempotent while running.
     */
    void start();

    /**
     * Release the loop and wait for its thread to finish the task it is running.
     * Idempotent while stopped. When called from the loop's own thread the
     * thread is released but not awaited.
     */
    void stop();

    /**
     * @return {@code true} between {@link #start()} and {@link #stop()}
     */
    boolean isRunning();

    /**
     * @return {@code true} if the calling thread is the loop's thread
     */
    boolean inLoop();

    /**
     * Run a task on the loop as soon as possible.
     */
    void execute(Runnable task);

    /**
     * Run a task on the loop once {@code delay} has elapsed.
     *
     * @return cancellation handle; {@link Cancellable#NONE} if the loop is stopped
     */
    Cancellable schedule(Duration delay, Runnable task);
}
