package com.questrail.wsclient.internal.exec;

import com.questrail.wsclient.config.ClientConfig;
import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ClientObservabilitySink;
import com.questrail.wsclient.observability.ConnectionEvent;
import com.questrail.wsclient.transport.AttemptStage;
import com.questrail.wsclient.transport.ConnectRequest;
import com.questrail.wsclient.transport.ConnectResult;
import com.questrail.wsclient.transport.WebSocketConnector;

import java.util.Objects;

/**
 * ConnectionAttemptHandler
 * =============================================================================
 * Drives one resolve → connect → handshake sequence with a fresh connection.
 *
 * <h2>Failure handling</h2>
 * Every failure, including an unexpected exception escaping the connector, is
 * returned as {@link ConnectResult.Failed}. Nothing is thrown and no partial
 * connection is retained; the caller decides when to try again.
 *
 * <h2>Threading</h2>
 * {@link #attempt()} blocks for the whole attempt. It runs on the I/O loop
 * thread, which keeps attempts strictly sequential.
 */
public final class ConnectionAttemptHandler {

    private final WebSocketConnector connector;
    private final ConnectRequest request;
    private final AttemptCounter attempts = new AttemptCounter();
    private final ClientObservabilitySink observabilitySink;

    public ConnectionAttemptHandler(WebSocketConnector connector,
                                    ClientConfig config,
                                    ClientObservabilitySink observabilitySink) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.request = requestFor(Objects.requireNonNull(config, "config"));
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Run one attempt.
     *
     * @return the connector's result; never {@code null}
     */
    public ConnectResult attempt() {
        int attempt = attempts.recordAttempt();
        String target = request.host() + ":" + request.port() + request.path();
        observabilitySink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.CONNECTING,
            target + " (attempt " + attempt + ")"));

        ConnectResult result;
        try {
            result = connector.connect(request);
            if (result == null) {
                result = new ConnectResult.Failed(AttemptStage.CONNECT,
                    new IllegalStateException("connector returned no result"));
            }
        } catch (RuntimeException e) {
            result = new ConnectResult.Failed(AttemptStage.CONNECT, e);
        }

        if (result instanceof ConnectResult.Connected) {
            attempts.reset();
            observabilitySink.onConnectionEvent(ConnectionEvent.of(ConnectionEvent.Kind.CONNECTED, target));
        } else {
            ConnectResult.Failed failed = (ConnectResult.Failed) result;
            observabilitySink.onError(ClientErrorEvent.of(ClientErrorEvent.Kind.ATTEMPT_FAILURE,
                "Connection to " + target + " failed at " + failed.stage() + " (attempt " + attempt + ")",
                failed.cause()));
        }
        return result;
    }

    /**
     * Attempts made since the last successful connection.
     */
    public int consecutiveAttempts() {
        return attempts.current();
    }

    static ConnectRequest requestFor(ClientConfig config) {
        return new ConnectRequest(
            config.host(),
            config.portNumber(),
            config.path(),
            config.userAgent(),
            config.secure(),
            config.maxFramePayloadLength(),
            config.retryPolicy().connectTimeout(),
            config.retryPolicy().writeTimeout()
        );
    }
}
