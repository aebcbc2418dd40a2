package com.questrail.wsclient.transport;

/**
 * WebSocketConnector
 * -----------------------------------------------------------------------------
 * Factory port that opens one brand-new connection per call.
 *
 * <p>{@link #connect(ConnectRequest)} performs the whole resolve, connect and
 * handshake sequence synchronously. Any failure aborts the attempt uniformly:
 * the implementation releases whatever it had opened and reports the stage that
 * failed. A connection is never reused once closed, so callers ask for a new one
 * for every attempt.</p>
 */
public interface WebSocketConnector
{
    /**
     * Open a new connection.
     *
     * @param request where and how to connect
     * @return {@link ConnectResult.Connected} with a live connection, or
     *         {@link ConnectResult.Failed} naming the failed stage
     */
    ConnectResult connect(ConnectRequest request);
}
