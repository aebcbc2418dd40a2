package com.questrail.wsclient.internal.state;

import com.questrail.wsclient.api.ClientStatus;
import com.questrail.wsclient.config.ClientConfig;
import com.questrail.wsclient.internal.exec.ConnectionAttemptHandler;
import com.questrail.wsclient.internal.exec.OutboundMessageQueue;
import com.questrail.wsclient.internal.exec.ReadLoop;
import com.questrail.wsclient.internal.exec.ReconnectDispatcher;
import com.questrail.wsclient.internal.exec.ReconnectScheduler;
import com.questrail.wsclient.internal.exec.SingleShotTimer;
import com.questrail.wsclient.internal.loop.IoLoop;
import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ClientObservabilitySink;
import com.questrail.wsclient.observability.ClientStateTransitionEvent;
import com.questrail.wsclient.observability.ConnectionEvent;
import com.questrail.wsclient.transport.ConnectResult;
import com.questrail.wsclient.transport.WebSocketConnection;
import com.questrail.wsclient.transport.WebSocketConnector;
import com.questrail.wsclient.transport.WriteResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ConnectionStateController
 * =============================================================================
 * Single source of truth for whether the client should be active, and the
 * orchestrator of start, stop and reconnect.
 *
 * <h2>State</h2>
 * <ul>
 *   <li><b>shouldBeActive</b>: the caller's intent; survives reconnects</li>
 *   <li><b>connection</b>: the installed connection, replaced on every attempt</li>
 *   <li><b>generation</b>: bumped on every teardown so that attempts, timers
 *       and read faults belonging to an older connection cycle are ignored</li>
 *   <li><b>attemptInFlight</b>: set while the one connection attempt runs</li>
 * </ul>
 *
 * <h2>Locks</h2>
 * <p>The <em>state lock</em> guards every field above together with the
 * outbound queue and both retry timers. It is held only for short,
 * non-blocking sections and never across a connect, handshake or write, and
 * never while invoking the message callback.</p>
 *
 * <p>The <em>lifecycle lock</em> serializes start, stop and reconnect. It is
 * the only lock held while joining the I/O loop thread. Lifecycle work is
 * expressed as convergence: whoever holds the lifecycle lock brings the running
 * machinery in line with {@code shouldBeActive}, and re-checks after releasing
 * it. A caller on the I/O loop thread (for example a message callback calling
 * {@code stop()}) never blocks on the lifecycle lock, since its holder may be
 * waiting for that very thread; it records its intent and leaves the work to
 * the holder.</p>
 *
 * <h2>Threads</h2>
 * <pre>
 *   caller threads  ── start / stop / send
 *   I/O loop thread ── connection attempts, retry timers, read completions
 *   reconnect thread ── stop-then-start after a read fault
 * </pre>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>While active: exactly one of {attempt in flight, retry timer pending,
 *       connection installed}.</li>
 *   <li>At most one I/O loop thread exists.</li>
 *   <li>When stopped by a thread other than the loop thread: no loop thread,
 *       no reconnect thread and no armed timer remain once {@link #stop()} returns.</li>
 * </ul>
 */
public final class ConnectionStateController {

    private final ClientConfig config;
    private final IoLoop loop;
    private final ConnectionAttemptHandler attemptHandler;
    private final ReconnectScheduler reconnectScheduler;
    private final OutboundMessageQueue queue;
    private final ReconnectDispatcher dispatcher;
    private final ClientObservabilitySink observabilitySink;
    private final Duration shutdownTimeout;

    private final Object stateLock = new Object();
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Queue<ExecutorService> retiredDispatchers = new ConcurrentLinkedQueue<>();

    // guarded by stateLock
    private boolean shouldBeActive;
    private boolean attemptInFlight;
    private long generation;
    private WebSocketConnection connection;
    private ReadLoop readLoop;
    private ClientStatus lastPublished = ClientStatus.STOPPED;

    // guarded by lifecycleLock; read without it only to decide whether to re-check
    private volatile boolean activated;

    public ConnectionStateController(ClientConfig config,
                                     WebSocketConnector connector,
                                     IoLoop loop,
                                     ReconnectDispatcher dispatcher,
                                     ClientObservabilitySink observabilitySink) {
        this.config = Objects.requireNonNull(config, "config");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.shutdownTimeout = config.retryPolicy().shutdownTimeout();

        this.attemptHandler = new ConnectionAttemptHandler(connector, config, observabilitySink);
        this.reconnectScheduler = new ReconnectScheduler(
            new SingleShotTimer(loop, config.retryPolicy().startRetryDelay()), observabilitySink);
        this.queue = new OutboundMessageQueue(
            stateLock,
            this::installedConnection,
            new SingleShotTimer(loop, config.retryPolicy().queueRetryDelay()),
            observabilitySink);
    }

    // -------------------------------------------------------------------------
    // Caller-facing operations
    // -------------------------------------------------------------------------

    /**
     * Declare the connection active. No-op if already active.
     */
    public void start() {
        synchronized (stateLock) {
            if (shouldBeActive) {
                return;
            }
            shouldBeActive = true;
        }
        converge();
    }

    /**
     * Declare the connection inactive and tear everything down. No-op if
     * already inactive.
     */
    public void stop() {
        synchronized (stateLock) {
            if (!shouldBeActive) {
                return;
            }
            shouldBeActive = false;
        }
        converge();
    }

    /**
     * Single synchronous write on the installed connection.
     *
     * @return {@code false} if there is no connection or the write failed
     */
    public boolean sendImmediate(String payload) {
        Objects.requireNonNull(payload, "payload");
        final WebSocketConnection current;
        synchronized (stateLock) {
            current = connection;
        }
        if (current == null) {
            return false;
        }

        WriteResult result;
        try {
            result = current.write(payload);
        } catch (RuntimeException e) {
            result = WriteResult.failed(e);
        }
        if (!result.isSuccess()) {
            observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.WRITE_FAILURE,
                "Immediate write failed; message dropped", result.cause()));
        }
        return result.isSuccess();
    }

    /**
     * Append to the outbound queue and drain it right away.
     */
    public void sendQueued(String payload) {
        queue.enqueue(payload);
        queue.drain();
    }

    public ClientStatus status() {
        synchronized (stateLock) {
            return computeStatus();
        }
    }

    public boolean isActive() {
        synchronized (stateLock) {
            return shouldBeActive;
        }
    }

    public boolean isConnected() {
        synchronized (stateLock) {
            return connection != null && connection.isOpen();
        }
    }

    public int pendingMessageCount() {
        return queue.size();
    }

    /**
     * @return {@code true} if either retry timer is armed
     */
    public boolean hasPendingTimers() {
        synchronized (stateLock) {
            return reconnectScheduler.isPending() || queue.isRetryPending();
        }
    }

    // -------------------------------------------------------------------------
    // Lifecycle convergence
    // -------------------------------------------------------------------------

    private void converge() {
        boolean onLoop = loop.inLoop();
        do {
            if (onLoop) {
                if (!lifecycleLock.tryLock()) {
                    // The holder re-checks the intent before and after releasing the lock.
                    return;
                }
            } else {
                lifecycleLock.lock();
            }
            try {
                reconcile();
            } finally {
                lifecycleLock.unlock();
            }
            if (!onLoop && !dispatcher.inDispatchedTask()) {
                awaitRetiredDispatchers();
            }
        } while (needsReconcile());
    }

    /**
     * Bring the loop, the dispatcher and the connection in line with the intent.
     * Caller holds the lifecycle lock.
     */
    private void reconcile() {
        while (true) {
            final boolean want;
            synchronized (stateLock) {
                want = shouldBeActive;
            }
            if (want == activated) {
                return;
            }

            if (want) {
                dispatcher.activate();
                internalStart();
                activated = true;
            } else {
                ExecutorService retired = dispatcher.retire();
                if (retired != null) {
                    retiredDispatchers.add(retired);
                }
                internalStop();
                activated = false;
                observabilitySink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.STOPPED,
                    config.host() + ":" + config.port() + config.path()));
            }
            publishStatus();
        }
    }

    private boolean needsReconcile() {
        synchronized (stateLock) {
            return shouldBeActive != activated;
        }
    }

    private void awaitRetiredDispatchers() {
        ExecutorService retired;
        while ((retired = retiredDispatchers.poll()) != null) {
            if (!ReconnectDispatcher.awaitTermination(retired, shutdownTimeout)) {
                observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.LOOP_FAILURE,
                    "Reconnect thread did not finish within " + shutdownTimeout + "; interrupted", null));
            }
        }
    }

    /**
     * Start the loop and submit the first attempt. Caller holds the lifecycle lock.
     */
    private void internalStart() {
        loop.start();
        final long attemptGeneration;
        synchronized (stateLock) {
            attemptGeneration = generation;
            attemptInFlight = true;
        }
        loop.execute(() -> runAttempt(attemptGeneration));
    }

    /**
     * Cancel timers, close the connection and join the loop. Caller holds the
     * lifecycle lock.
     */
    private void internalStop() {
        final WebSocketConnection closing;
        final ReadLoop endingReadLoop;
        synchronized (stateLock) {
            generation++;
            attemptInFlight = false;
            reconnectScheduler.cancel();
            closing = connection;
            endingReadLoop = readLoop;
            connection = null;
            readLoop = null;
        }
        // The connection is already cleared, so a drain finishing now cannot re-arm this.
        queue.cancelRetry();

        if (endingReadLoop != null) {
            endingReadLoop.stop();
        }
        if (closing != null) {
            closing.closeAsync();
        }
        loop.stop();
    }

    // -------------------------------------------------------------------------
    // I/O loop tasks
    // -------------------------------------------------------------------------

    private void runAttempt(long attemptGeneration) {
        synchronized (stateLock) {
            if (!shouldBeActive || attemptGeneration != generation) {
                return;
            }
            attemptInFlight = true;
        }
        publishStatus();

        ConnectResult result = attemptHandler.attempt();

        WebSocketConnection stale = null;
        ReadLoop started = null;
        synchronized (stateLock) {
            boolean current = shouldBeActive && attemptGeneration == generation;
            if (current) {
                attemptInFlight = false;
            }
            if (result instanceof ConnectResult.Connected connected) {
                if (current) {
                    connection = connected.connection();
                    readLoop = new ReadLoop(connection, loop, config.callback(), this::onReadFault, observabilitySink);
                    started = readLoop;
                } else {
                    stale = connected.connection();
                }
            } else if (current) {
                reconnectScheduler.scheduleDelayedStart(() -> runAttempt(attemptGeneration));
            }
        }

        if (stale != null) {
            stale.closeAsync();
        }
        if (started != null) {
            started.start();
            queue.drain();
        }
        publishStatus();
    }

    private void onReadFault(WebSocketConnection faulted, Throwable cause) {
        synchronized (stateLock) {
            if (!shouldBeActive || connection != faulted) {
                return;
            }
        }
        observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.READ_FAULT,
            "Connection lost; reconnecting", cause));
        dispatcher.dispatch(() -> reconnect(faulted));
        publishStatus();
    }

    // -------------------------------------------------------------------------
    // Reconnect (dispatcher thread)
    // -------------------------------------------------------------------------

    private void reconnect(WebSocketConnection faulted) {
        lifecycleLock.lock();
        try {
            synchronized (stateLock) {
                // A stop, or a stop-start that already replaced the connection, wins.
                if (!shouldBeActive || connection != faulted) {
                    return;
                }
            }
            if (activated) {
                observabilitySink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.RECONNECTING,
                    config.host() + ":" + config.port() + config.path()));
                internalStop();
                internalStart();
                publishStatus();
            }
            reconcile();
        } finally {
            lifecycleLock.unlock();
        }
        if (needsReconcile()) {
            converge();
        }
    }

    // -------------------------------------------------------------------------
    // Status
    // -------------------------------------------------------------------------

    /** Caller holds the state lock. */
    private WebSocketConnection installedConnection() {
        return shouldBeActive ? connection : null;
    }

    /** Caller holds the state lock. */
    private ClientStatus computeStatus() {
        if (!shouldBeActive) {
            return ClientStatus.STOPPED;
        }
        if (connection != null && connection.isOpen()) {
            return ClientStatus.CONNECTED;
        }
        if (!attemptInFlight && reconnectScheduler.isPending()) {
            return ClientStatus.WAITING_TO_RETRY;
        }
        return ClientStatus.CONNECTING;
    }

    /**
     * Report a status change. Emitted under the state lock so that listeners
     * see transitions in the order they happened.
     */
    private void publishStatus() {
        synchronized (stateLock) {
            ClientStatus current = computeStatus();
            if (current == lastPublished) {
                return;
            }
            ClientStatus previous = lastPublished;
            lastPublished = current;
            observabilitySink.onStateTransition(new ClientStateTransitionEvent(Instant.now(), previous, current));
        }
    }
}
