package com.questrail.wsclient.transport;

/**
 * WebSocketConnection
 * -----------------------------------------------------------------------------
 * One open WebSocket, as produced by a {@link WebSocketConnector}.
 *
 * <h2>Reads</h2>
 * Reads are asynchronous and one-shot: {@link #read(ReadHandler)} requests the
 * next message and the handler is completed exactly once. Reads do not repeat
 * on their own; the caller issues the next read after each completion. At most
 * one read may be outstanding.
 *
 * <h2>Writes</h2>
 * {@link #write(String)} blocks until the message has been handed to the
 * network or the write has failed. Implementations must tolerate writes from
 * any thread other than their own I/O threads.
 *
 * <h2>Close</h2>
 * {@link #closeAsync()} starts an orderly close and returns immediately. An
 * outstanding read then completes with {@link ReadOutcome.Cancelled}; a read
 * that ends because the peer or the network dropped the connection completes
 * with {@link ReadOutcome.Failed}.
 */
public interface WebSocketConnection
{
    /**
     * Request the next inbound message.
     *
     * @param handler completed once, on an arbitrary thread
     * @throws IllegalStateException if a read is already outstanding
     */
    void read(ReadHandler handler);

    /**
     * Write one text message, blocking until it completes.
     *
     * @param payload text payload
     * @return the outcome of the write; never {@code null}
     */
    WriteResult write(String payload);

    /**
     * Begin closing the connection with a normal close code. Idempotent.
     */
    void closeAsync();

    /**
     * @return {@code true} while the handshake has completed and no close has
     *         been requested or observed
     */
    boolean isOpen();
}
