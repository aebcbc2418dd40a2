package com.questrail.wsclient.internal.exec;

import com.questrail.wsclient.internal.loop.Cancellable;
import com.questrail.wsclient.internal.loop.IoLoop;

import java.time.Duration;
import java.util.Objects;

/**
 * SingleShotTimer
 * -----------------------------------------------------------------------------
 * Fixed-delay timer on an {@link IoLoop} with at most one pending instance.
 *
 * <p>{@link #arm(Runnable)} cancels whatever was pending before scheduling the
 * new action. An action whose timer was cancelled or re-armed never runs, even
 * if the loop had already picked it up when the cancel happened.</p>
 */
public final class SingleShotTimer {

    private final IoLoop loop;
    private final Duration delay;

    private Cancellable pending = Cancellable.NONE;
    private long sequence;
    private boolean armed;

    public SingleShotTimer(IoLoop loop, Duration delay) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    /**
     * Cancel any pending action and schedule {@code action} after the fixed delay.
     */
    public synchronized void arm(Runnable action) {
        Objects.requireNonNull(action, "action");
        cancel();
        final long token = ++sequence;
        armed = true;
        pending = loop.schedule(delay, () -> fire(token, action));
        if (pending == Cancellable.NONE) {
            // The loop is stopped and dropped the task.
            armed = false;
        }
    }

    /**
     * Cancel the pending action, if any.
     */
    public synchronized void cancel() {
        pending.cancel();
        pending = Cancellable.NONE;
        armed = false;
        sequence++;
    }

    /**
     * @return {@code true} while an action is scheduled and has not started
     */
    public synchronized boolean isArmed() {
        return armed;
    }

    public Duration delay() {
        return delay;
    }

    private void fire(long token, Runnable action) {
        synchronized (this) {
            if (!armed || token != sequence) {
                return;
            }
            armed = false;
            pending = Cancellable.NONE;
        }
        action.run();
    }
}
