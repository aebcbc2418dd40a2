package com.questrail.wsclient.observability;

import java.time.Instant;

/**
 * Record representing a recoverable failure inside the client.
 *
 * @param cause underlying exception; may be {@code null}
 */
public record ClientErrorEvent(
    Instant timestamp,
    Kind kind,
    String message,
    Throwable cause
) {
    public enum Kind {
        /** Resolve, connect or handshake failed. */
        ATTEMPT_FAILURE,
        /** A read ended with something other than a deliberate close. */
        READ_FAULT,
        /** A write failed. */
        WRITE_FAILURE,
        /** The message callback or the status listener threw. */
        CALLBACK_FAILURE,
        /** A task on the I/O loop threw, or the loop could not be shut down. */
        LOOP_FAILURE
    }

    public static ClientErrorEvent of(Kind kind, String message, Throwable cause) {
        return new ClientErrorEvent(Instant.now(), kind, message, cause);
    }
}
