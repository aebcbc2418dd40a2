package com.questrail.wsclient.internal.exec;

import com.questrail.wsclient.api.MessageCallback;
import com.questrail.wsclient.internal.loop.IoLoop;
import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ClientObservabilitySink;
import com.questrail.wsclient.transport.ReadOutcome;
import com.questrail.wsclient.transport.WebSocketConnection;

import java.util.Objects;

/**
 * ReadLoop
 * =============================================================================
 * Keeps exactly one read outstanding on one connection.
 *
 * <h2>Cycle</h2>
 * <pre>
 *   arm read ──► completion hops onto the I/O loop
 *      ▲            │
 *      │   Message  ├─► deliver to callback ─► re-arm
 *      │            │
 *      └── Cancelled├─► end silently (this side closed the connection)
 *                   │
 *           Failed  └─► report fault once ─► end
 * </pre>
 *
 * <p>Reads do not repeat on their own, so the loop re-arms after every
 * delivered message. A read loop never outlives its connection: it is created
 * per connection and ends on the first cancellation, fault or {@link #stop()}.</p>
 *
 * <p>All completions are handled on the {@link IoLoop}; the message callback
 * therefore runs on the loop thread, one message at a time.</p>
 */
public final class ReadLoop {

    /**
     * Receives the fault that ended a read loop.
     */
    @FunctionalInterface
    public interface FaultListener {
        void onReadFault(WebSocketConnection connection, Throwable cause);
    }

    private final WebSocketConnection connection;
    private final IoLoop loop;
    private final MessageCallback callback;
    private final FaultListener faultListener;
    private final ClientObservabilitySink observabilitySink;

    private volatile boolean stopped;

    public ReadLoop(WebSocketConnection connection,
                    IoLoop loop,
                    MessageCallback callback,
                    FaultListener faultListener,
                    ClientObservabilitySink observabilitySink) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.faultListener = Objects.requireNonNull(faultListener, "faultListener");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Arm the first read.
     */
    public void start() {
        arm();
    }

    /**
     * Stop re-arming. A read already outstanding still completes, but its
     * outcome is ignored.
     */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    private void arm() {
        if (stopped) {
            return;
        }
        connection.read(outcome -> loop.execute(() -> onReadComplete(outcome)));
    }

    private void onReadComplete(ReadOutcome outcome) {
        if (stopped) {
            return;
        }

        if (outcome instanceof ReadOutcome.Message message) {
            deliver(message.payload());
            arm();
        } else if (outcome instanceof ReadOutcome.Failed failed) {
            stopped = true;
            faultListener.onReadFault(connection, failed.cause());
        } else {
            stopped = true;
        }
    }

    private void deliver(String payload) {
        try {
            callback.onMessage(payload);
        } catch (RuntimeException e) {
            observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.CALLBACK_FAILURE,
                "Message callback threw; message dropped", e));
        }
    }
}
