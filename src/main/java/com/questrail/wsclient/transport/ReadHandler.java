package com.questrail.wsclient.transport;

/**
 * Completion callback for {@link WebSocketConnection#read(ReadHandler)}.
 */
@FunctionalInterface
public interface ReadHandler
{
    void onReadComplete(ReadOutcome outcome);
}
