package com.questrail.wsclient.internal.exec;

import com.questrail.wsclient.observability.ClientObservabilitySink;
import com.questrail.wsclient.observability.ConnectionEvent;

import java.util.Objects;

/**
 * ReconnectScheduler
 * -----------------------------------------------------------------------------
 * Gates connection attempts after a failure.
 *
 * <p>Wraps the start-delay {@link SingleShotTimer}. Scheduling replaces any
 * pending attempt, so at most one retry is ever waiting. The delay is fixed;
 * repeated failures do not lengthen it.</p>
 *
 * <p>The scheduled attempt is expected to re-check whether the client should
 * still be active before doing anything.</p>
 */
public final class ReconnectScheduler {

    private final SingleShotTimer startDelayTimer;
    private final ClientObservabilitySink observabilitySink;

    public ReconnectScheduler(SingleShotTimer startDelayTimer, ClientObservabilitySink observabilitySink) {
        this.startDelayTimer = Objects.requireNonNull(startDelayTimer, "startDelayTimer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Arm the start-delay timer to run {@code attempt} once the fixed delay elapses.
     */
    public void scheduleDelayedStart(Runnable attempt) {
        startDelayTimer.arm(attempt);
        observabilitySink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.RETRY_SCHEDULED,
            "next attempt in " + startDelayTimer.delay()));
    }

    /**
     * Prevent a pending attempt from running.
     */
    public void cancel() {
        startDelayTimer.cancel();
    }

    public boolean isPending() {
        return startDelayTimer.isArmed();
    }
}
