package com.questrail.wsclient.api;

/**
 * ClientStatus
 * -----------------------------------------------------------------------------
 * Coarse-grained view of a {@link WebSocketClient}, derived from the caller's
 * intent and the state of the current connection.
 *
 * <h2>Status Transitions</h2>
 * No guarantees are made about the order in which an observer sees
 * transitions. The status is a snapshot and may be stale as soon as it is
 * returned.
 */
public enum ClientStatus
{
    /**
     * The caller has not started the client, or has stopped it.
     */
    STOPPED,

    /**
     * The client is started and a connection attempt is in progress.
     */
    CONNECTING,

    /**
     * The client is started and the connection is open.
     */
    CONNECTED,

    /**
     * The client is started, the last attempt failed, and the next attempt is
     * waiting for the fixed retry delay to elapse.
     */
    WAITING_TO_RETRY
}
