package com.questrail.wsclient.transport;

import java.util.Objects;

/**
 * ConnectResult
 * -----------------------------------------------------------------------------
 * Outcome of one {@link WebSocketConnector#connect(ConnectRequest)} call.
 *
 * <p>A failed attempt holds no connection: the connector has already released
 * everything it opened along the way.</p>
 */
public sealed interface ConnectResult
        permits ConnectResult.Connected, ConnectResult.Failed
{
    /** The handshake completed and the connection is open. */
    record Connected(WebSocketConnection connection) implements ConnectResult {
        public Connected {
            Objects.requireNonNull(connection, "connection");
        }
    }

    /** The attempt was abandoned at {@code stage}. */
    record Failed(AttemptStage stage, Throwable cause) implements ConnectResult {
        public Failed {
            Objects.requireNonNull(stage, "stage");
        }
    }
}
