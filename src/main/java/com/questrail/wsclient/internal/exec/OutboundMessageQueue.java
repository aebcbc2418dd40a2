package com.questrail.wsclient.internal.exec;

import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ClientObservabilitySink;
import com.questrail.wsclient.observability.ConnectionEvent;
import com.questrail.wsclient.transport.WebSocketConnection;
import com.questrail.wsclient.transport.WriteResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * OutboundMessageQueue
 * =============================================================================
 * FIFO buffer of outbound payloads that survives reconnects.
 *
 * <h2>Drain algorithm</h2>
 * <pre>
 *   while queue non-empty and connection live:
 *       write head (blocking)
 *       success → pop, continue
 *       failure → keep head, arm queue retry timer, stop
 * </pre>
 *
 * <p>A failed write never triggers a reconnect. A broken connection is noticed
 * independently by the read loop; the next connection drains the queue again.</p>
 *
 * <h2>Locking</h2>
 * <p>Queue contents, the drain flag and the retry timer are guarded by the
 * controller's state lock, which is passed in. Writes run outside that lock.
 * Only one drain runs at a time: a drain request that finds another drain in
 * progress returns at once, and the running drain picks up anything appended
 * meanwhile because it re-reads the head under the lock on every iteration.</p>
 *
 * <h2>Delivery contract</h2>
 * <p>At-least-once. A failed write may still have reached the peer; the same
 * payload is written again on the next drain.</p>
 */
public final class OutboundMessageQueue {

    private final Object stateLock;
    private final Supplier<WebSocketConnection> liveConnection;
    private final SingleShotTimer queueRetryTimer;
    private final ClientObservabilitySink observabilitySink;

    private final Deque<String> messages = new ArrayDeque<>();
    private boolean draining;

    /**
     * @param stateLock         the controller's state lock
     * @param liveConnection    returns the connection currently installed by the
     *                          controller, or {@code null} when stopped or between
     *                          connections; always invoked with {@code stateLock} held
     * @param queueRetryTimer   timer used to retry after a failed write
     * @param observabilitySink receives write failures and retry notices
     */
    public OutboundMessageQueue(Object stateLock,
                                Supplier<WebSocketConnection> liveConnection,
                                SingleShotTimer queueRetryTimer,
                                ClientObservabilitySink observabilitySink) {
        this.stateLock = Objects.requireNonNull(stateLock, "stateLock");
        this.liveConnection = Objects.requireNonNull(liveConnection, "liveConnection");
        this.queueRetryTimer = Objects.requireNonNull(queueRetryTimer, "queueRetryTimer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Append a payload at the tail.
     */
    public void enqueue(String payload) {
        Objects.requireNonNull(payload, "payload");
        synchronized (stateLock) {
            messages.addLast(payload);
        }
    }

    /**
     * Write queued payloads, head first, until the queue is empty, the
     * connection goes away, or a write fails.
     */
    public void drain() {
        final WebSocketConnection connection;
        synchronized (stateLock) {
            if (draining || messages.isEmpty()) {
                return;
            }
            connection = liveConnection.get();
            if (connection == null || !connection.isOpen()) {
                return;
            }
            draining = true;
        }

        while (true) {
            final String head;
            synchronized (stateLock) {
                head = messages.peekFirst();
                if (head == null || liveConnection.get() != connection || !connection.isOpen()) {
                    draining = false;
                    return;
                }
            }

            WriteResult result = write(connection, head);

            synchronized (stateLock) {
                if (!result.isSuccess()) {
                    draining = false;
                    // A stop or reconnect that cleared the connection also cancelled the timer.
                    if (liveConnection.get() == connection) {
                        queueRetryTimer.arm(this::drain);
                        observabilitySink.onConnectionEvent(ConnectionEvent.of(
                            ConnectionEvent.Kind.QUEUE_RETRY_SCHEDULED,
                            messages.size() + " queued, retry in " + queueRetryTimer.delay()));
                    }
                    observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.WRITE_FAILURE,
                        "Queued write failed; message kept at head of queue", result.cause()));
                    return;
                }
                // Only the draining thread removes, so the head is still the payload just written.
                messages.pollFirst();
            }
        }
    }

    /**
     * Prevent a pending retry from running. Queued payloads are kept.
     */
    public void cancelRetry() {
        synchronized (stateLock) {
            queueRetryTimer.cancel();
        }
    }

    public boolean isRetryPending() {
        synchronized (stateLock) {
            return queueRetryTimer.isArmed();
        }
    }

    public int size() {
        synchronized (stateLock) {
            return messages.size();
        }
    }

    /**
     * @return a copy of the queued payloads, head first
     */
    public List<String> snapshot() {
        synchronized (stateLock) {
            return List.copyOf(messages);
        }
    }

    private static WriteResult write(WebSocketConnection connection, String payload) {
        try {
            return connection.write(payload);
        } catch (RuntimeException e) {
            return WriteResult.failed(e);
        }
    }
}
