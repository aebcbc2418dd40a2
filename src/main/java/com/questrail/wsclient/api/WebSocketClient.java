package com.questrail.wsclient.api;

/**
 * WebSocketClient
 * -----------------------------------------------------------------------------
 * {@code WebSocketClient} is the caller-facing façade for one persistent,
 * message-oriented connection that survives transient network failure.
 *
 * <h2>Core Responsibilities</h2>
 * A {@code WebSocketClient} is responsible for:
 * <ul>
 *   <li>Remembering whether the caller wants the connection to be up (INTENT)</li>
 *   <li>Re-establishing the connection after failures while that intent holds</li>
 *   <li>Delivering every inbound message to a {@link MessageCallback}</li>
 *   <li>Buffering outbound messages that the caller asks to be queued</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Framing, encoding or the opening handshake (delegated to the transport)</li>
 *   <li>Multiplexing several logical streams over one connection</li>
 *   <li>Exactly-once delivery</li>
 * </ul>
 *
 * <h2>Intent vs Connection</h2>
 * {@link #start()} and {@link #stop()} change the caller's intent, not the
 * connection itself. While started, the client keeps trying to connect at a
 * fixed interval until it succeeds or is stopped. A stopped client holds no
 * thread and no armed timer.
 *
 * <h2>Threading and Concurrency</h2>
 * Implementations must be safe to call from any number of threads.
 *
 * <h2>Lifecycle</h2>
 * {@link #close()} implies {@link #stop()}. A closed client cannot be restarted.
 */
public interface WebSocketClient extends AutoCloseable
{
    /**
     * Declares that the connection should be active.
     * <p>
     * Idempotent: calling {@code start()} on a started client has no effect.
     * Returns without waiting for the first connection attempt to finish.
     */
    void start();

    /**
     * Declares that the connection should be inactive and releases every
     * background resource.
     * <p>
     * Idempotent: calling {@code stop()} on a stopped (or never started) client
     * has no effect. When this method returns, the background thread has been
     * joined and no retry timer is armed. Queued messages are kept for the next
     * {@link #start()}.
     */
    void stop();

    /**
     * Writes a message on the current connection, dropping it if that fails.
     *
     * @param payload text payload (must not be {@code null})
     * @return {@code true} if the write completed, {@code false} if there is no
     *         connection or the write failed
     */
    default boolean sendMessage(String payload) {
        return sendMessage(payload, false);
    }

    /**
     * Sends a message.
     * <p>
     * When {@code queueIfOffline} is {@code false} this is a single synchronous
     * write attempt; on failure the message is dropped and {@code false} is
     * returned. When {@code true} the message is appended to the outbound queue,
     * which is drained in FIFO order whenever a connection is open, and the
     * method returns {@code true} as soon as the message is queued.
     *
     * @param payload        text payload (must not be {@code null})
     * @param queueIfOffline whether to queue the message for guaranteed ordering
     *                       and later delivery
     * @return the outcome described above
     */
    boolean sendMessage(String payload, boolean queueIfOffline);

    /**
     * Returns the current coarse-grained connection status.
     */
    ClientStatus status();

    /**
     * Stops the client permanently.
     */
    @Override
    void close();
}
