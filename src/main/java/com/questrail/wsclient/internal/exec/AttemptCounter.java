package com.questrail.wsclient.internal.exec;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consecutive connection-attempt counter.
 *
 * - Counts attempts since the last successful connection
 * - Resets on success
 * - Does not encode retry policy; the delay stays fixed whatever the count
 */
public final class AttemptCounter {

    private final AtomicInteger attempts = new AtomicInteger();

    /**
     * Record that an attempt is starting.
     *
     * @return the updated attempt count
     */
    public int recordAttempt() {
        return attempts.incrementAndGet();
    }

    /**
     * Reset after a successful connection.
     */
    public void reset() {
        attempts.set(0);
    }

    /**
     * Current attempt count (0 if none since the last success).
     */
    public int current() {
        return attempts.get();
    }
}
