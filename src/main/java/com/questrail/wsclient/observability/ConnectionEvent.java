package com.questrail.wsclient.observability;

import java.time.Instant;

/**
 * Record representing a connection lifecycle milestone.
 *
 * @param detail free-text context (endpoint, attempt number, delay); may be empty
 */
public record ConnectionEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        /** A connection attempt is starting. */
        CONNECTING,
        /** The handshake completed. */
        CONNECTED,
        /** The next attempt has been scheduled after the fixed delay. */
        RETRY_SCHEDULED,
        /** A broken connection is being replaced. */
        RECONNECTING,
        /** A failed queue write will be retried after the fixed delay. */
        QUEUE_RETRY_SCHEDULED,
        /** The background I/O loop thread finished. */
        LOOP_EXITED,
        /** The caller stopped the client. */
        STOPPED
    }

    public static ConnectionEvent of(Kind kind, String detail) {
        return new ConnectionEvent(Instant.now(), kind, detail);
    }
}
