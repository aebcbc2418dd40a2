package com.questrail.wsclient.internal.loop;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a task scheduled on an {@link IoLoop}.
 */
public interface Cancellable
{
    /** Handle for a task that will never run. */
    Cancellable NONE = () -> false;

    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed, is executing, or was previously cancelled.
     */
    boolean cancel();
}
