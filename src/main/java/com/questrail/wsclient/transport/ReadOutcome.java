package com.questrail.wsclient.transport;

import java.util.Objects;

/**
 * ReadOutcome
 * -----------------------------------------------------------------------------
 * Result of one asynchronous read.
 *
 * <ul>
 *   <li>{@link Message} carries one complete payload.</li>
 *   <li>{@link Cancelled} means the read ended because this side closed the
 *       connection. It is an expected shutdown artifact, not a fault.</li>
 *   <li>{@link Failed} means the connection broke for any other reason.</li>
 * </ul>
 */
public sealed interface ReadOutcome
        permits ReadOutcome.Message, ReadOutcome.Cancelled, ReadOutcome.Failed
{
    /** Singleton cancellation outcome. */
    ReadOutcome CANCELLED = new Cancelled();

    record Message(String payload) implements ReadOutcome {
        public Message {
            Objects.requireNonNull(payload, "payload");
        }
    }

    record Cancelled() implements ReadOutcome {
    }

    record Failed(Throwable cause) implements ReadOutcome {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
