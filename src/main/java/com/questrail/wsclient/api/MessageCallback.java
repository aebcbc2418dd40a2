package com.questrail.wsclient.api;

/**
 * Receives each inbound message delivered by a {@link WebSocketClient}.
 *
 * <p>Callbacks are invoked one at a time, in arrival order, on the client's
 * background I/O thread. A slow callback delays the next read. Exceptions
 * thrown from the callback are reported and otherwise ignored.</p>
 */
@FunctionalInterface
public interface MessageCallback
{
    /**
     * @param payload the full message payload
     */
    void onMessage(String payload);
}
