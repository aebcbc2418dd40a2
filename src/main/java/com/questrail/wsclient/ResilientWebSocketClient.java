package com.questrail.wsclient;

import com.questrail.wsclient.api.ClientStatus;
import com.questrail.wsclient.api.MessageCallback;
import com.questrail.wsclient.api.WebSocketClient;
import com.questrail.wsclient.config.ClientConfig;
import com.questrail.wsclient.config.RetryPolicy;
import com.questrail.wsclient.internal.exec.ReconnectDispatcher;
import com.questrail.wsclient.internal.loop.IoLoop;
import com.questrail.wsclient.internal.loop.IoLoopRunner;
import com.questrail.wsclient.internal.state.ConnectionStateController;
import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ClientObservabilitySink;
import com.questrail.wsclient.observability.ClientStateTransitionEvent;
import com.questrail.wsclient.observability.ConnectionEvent;
import com.questrail.wsclient.observability.Slf4jClientObservabilitySink;
import com.questrail.wsclient.transport.WebSocketConnector;
import com.questrail.wsclient.transport.netty.NettyWebSocketConnector;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * ResilientWebSocketClient
 * =============================================================================
 * Composition root and lifecycle owner for one resilient WebSocket connection.
 *
 * <pre>{@code
 * try (WebSocketClient client = ResilientWebSocketClient.builder()
 *         .withHost("example.test")
 *         .withPort("443")
 *         .withPath("/stream")
 *         .withCallback(payload -> System.out.println(payload))
 *         .build()) {
 *     client.start();
 *     client.sendMessage("ping", true);
 * }
 * }</pre>
 *
 * <p>All behavior lives in the {@link ConnectionStateController}; this class
 * wires the collaborators together and guards against use after
 * {@link #close()}.</p>
 */
public final class ResilientWebSocketClient implements WebSocketClient {

    static final String IO_LOOP_THREAD_NAME = "wsclient-io-loop";
    static final String RECONNECT_THREAD_NAME = "wsclient-reconnect";
    static final String NETTY_THREAD_NAME = "wsclient-netty";

    private final ConnectionStateController controller;

    private volatile boolean closed;

    private ResilientWebSocketClient(ConnectionStateController controller) {
        this.controller = controller;
    }

    @Override
    public void start() {
        if (closed) {
            throw new IllegalStateException("client is closed");
        }
        controller.start();
    }

    @Override
    public void stop() {
        controller.stop();
    }

    @Override
    public boolean sendMessage(String payload, boolean queueIfOffline) {
        Objects.requireNonNull(payload, "payload");
        if (queueIfOffline) {
            controller.sendQueued(payload);
            return true;
        }
        return controller.sendImmediate(payload);
    }

    @Override
    public ClientStatus status() {
        return controller.status();
    }

    public boolean isConnected() {
        return controller.isConnected();
    }

    /**
     * @return number of queued messages not yet written
     */
    public int pendingMessageCount() {
        return controller.pendingMessageCount();
    }

    @Override
    public void close() {
        closed = true;
        controller.stop();
    }

    // package-private for tests
    ConnectionStateController controller() {
        return controller;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final ClientConfig.Builder config = ClientConfig.builder();
        private ClientObservabilitySink observabilitySink = new Slf4jClientObservabilitySink();
        private Consumer<ClientStatus> statusListener;
        private WebSocketConnector connector;
        private IoLoop ioLoop;
        private Supplier<ExecutorService> reconnectExecutorFactory;

        public Builder withHost(String host) {
            config.withHost(host);
            return this;
        }

        public Builder withPort(String port) {
            config.withPort(port);
            return this;
        }

        public Builder withPort(int port) {
            config.withPort(port);
            return this;
        }

        public Builder withPath(String path) {
            config.withPath(path);
            return this;
        }

        public Builder withCallback(MessageCallback callback) {
            config.withCallback(callback);
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            config.withUserAgent(userAgent);
            return this;
        }

        public Builder withSecure(boolean secure) {
            config.withSecure(secure);
            return this;
        }

        public Builder withMaxFramePayloadLength(int maxFramePayloadLength) {
            config.withMaxFramePayloadLength(maxFramePayloadLength);
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            config.withRetryPolicy(retryPolicy);
            return this;
        }

        public Builder withObservabilitySink(ClientObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Receives every status change, after the observability sink. The
         * listener must not call back into the client.
         */
        public Builder withStatusListener(Consumer<ClientStatus> listener) {
            this.statusListener = listener;
            return this;
        }

        public Builder withConnector(WebSocketConnector connector) {
            this.connector = connector;
            return this;
        }

        // package-private for tests
        Builder withIoLoop(IoLoop ioLoop) {
            this.ioLoop = ioLoop;
            return this;
        }

        // package-private for tests
        Builder withReconnectExecutorFactory(Supplier<ExecutorService> factory) {
            this.reconnectExecutorFactory = factory;
            return this;
        }

        public ResilientWebSocketClient build() {
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            ClientConfig clientConfig = config.build();

            // 1. Diagnostics
            ClientObservabilitySink effectiveSink = statusListener == null
                ? observabilitySink
                : withStatusListener(observabilitySink, statusListener);

            // 2. Transport
            WebSocketConnector effectiveConnector = connector != null
                ? connector
                : new NettyWebSocketConnector(new DefaultThreadFactory(NETTY_THREAD_NAME, true));

            // 3. Background loop, one thread per activation
            IoLoop effectiveLoop = ioLoop != null
                ? ioLoop
                : new IoLoopRunner(
                    new DefaultThreadFactory(IO_LOOP_THREAD_NAME, true),
                    clientConfig.retryPolicy().shutdownTimeout(),
                    effectiveSink);

            // 4. Reconnect dispatcher, one thread per activation
            Supplier<ExecutorService> executorFactory = reconnectExecutorFactory;
            if (executorFactory == null) {
                ThreadFactory reconnectThreads = new DefaultThreadFactory(RECONNECT_THREAD_NAME, true);
                executorFactory = () -> Executors.newSingleThreadExecutor(reconnectThreads);
            }

            ConnectionStateController controller = new ConnectionStateController(
                clientConfig,
                effectiveConnector,
                effectiveLoop,
                new ReconnectDispatcher(executorFactory),
                effectiveSink);

            return new ResilientWebSocketClient(controller);
        }

        private static ClientObservabilitySink withStatusListener(ClientObservabilitySink delegate,
                                                                  Consumer<ClientStatus> listener) {
            return new ClientObservabilitySink() {
                @Override
                public void onStateTransition(ClientStateTransitionEvent event) {
                    delegate.onStateTransition(event);
                    try {
                        listener.accept(event.newStatus());
                    } catch (RuntimeException e) {
                        delegate.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.CALLBACK_FAILURE,
                            "Status listener threw on " + event.newStatus(), e));
                    }
                }

                @Override public void onConnectionEvent(ConnectionEvent event) { delegate.onConnectionEvent(event); }
                @Override public void onError(ClientErrorEvent event) { delegate.onError(event); }
            };
        }
    }
}
