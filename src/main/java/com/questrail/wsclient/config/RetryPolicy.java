package com.questrail.wsclient.config;

import java.time.Duration;
import java.util.Objects;

/**
 * RetryPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the client.
 *
 * <p>All delays are fixed. There is no backoff: a client that keeps failing to
 * connect keeps retrying at {@code startRetryDelay} until it succeeds or is
 * stopped.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>startRetryDelay</b>: Delay between a failed connection attempt and
 *       the next one.</li>
 *   <li><b>queueRetryDelay</b>: Delay between a failed write of the head of the
 *       outbound queue and the next drain.</li>
 *   <li><b>connectTimeout</b>: Upper bound for one whole connection attempt,
 *       shared by every resolved address and the opening handshake. Keep it
 *       below shutdownTimeout so that stop() never outlives an attempt.</li>
 *   <li><b>writeTimeout</b>: Upper bound for one synchronous write.</li>
 *   <li><b>shutdownTimeout</b>: How long {@code stop()} waits for the
 *       background thread to finish before forcing it down.</li>
 * </ul>
 */
public record RetryPolicy(
        Duration startRetryDelay,
        Duration queueRetryDelay,
        Duration connectTimeout,
        Duration writeTimeout,
        Duration shutdownTimeout
) {
    public RetryPolicy {
        requireNonNegative(startRetryDelay, "startRetryDelay");
        requireNonNegative(queueRetryDelay, "queueRetryDelay");
        requireNonNegative(connectTimeout, "connectTimeout");
        requireNonNegative(writeTimeout, "writeTimeout");
        requireNonNegative(shutdownTimeout, "shutdownTimeout");
    }

    /**
     * Default values:
     * <ul>
     *   <li>startRetryDelay: 10s</li>
     *   <li>queueRetryDelay: 1s</li>
     *   <li>connectTimeout: 10s</li>
     *   <li>writeTimeout: 10s</li>
     *   <li>shutdownTimeout: 30s</li>
     * </ul>
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(1),
                Duration.ofSeconds(10),
                Duration.ofSeconds(10),
                Duration.ofSeconds(30)
        );
    }

    public RetryPolicy withStartRetryDelay(Duration delay) {
        return new RetryPolicy(delay, queueRetryDelay, connectTimeout, writeTimeout, shutdownTimeout);
    }

    public RetryPolicy withQueueRetryDelay(Duration delay) {
        return new RetryPolicy(startRetryDelay, delay, connectTimeout, writeTimeout, shutdownTimeout);
    }

    public RetryPolicy withConnectTimeout(Duration timeout) {
        return new RetryPolicy(startRetryDelay, queueRetryDelay, timeout, writeTimeout, shutdownTimeout);
    }

    public RetryPolicy withWriteTimeout(Duration timeout) {
        return new RetryPolicy(startRetryDelay, queueRetryDelay, connectTimeout, timeout, shutdownTimeout);
    }

    public RetryPolicy withShutdownTimeout(Duration timeout) {
        return new RetryPolicy(startRetryDelay, queueRetryDelay, connectTimeout, writeTimeout, timeout);
    }

    private static void requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
