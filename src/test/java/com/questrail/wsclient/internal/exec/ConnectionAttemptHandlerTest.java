package com.questrail.wsclient.internal.exec;

import com.questrail.wsclient.config.ClientConfig;
import com.questrail.wsclient.config.RetryPolicy;
import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ConnectionEvent;
import com.questrail.wsclient.observability.RecordingObservabilitySink;
import com.questrail.wsclient.transport.AttemptStage;
import com.questrail.wsclient.transport.ConnectRequest;
import com.questrail.wsclient.transport.ConnectResult;
import com.questrail.wsclient.transport.FakeWebSocketConnection;
import com.questrail.wsclient.transport.FakeWebSocketConnector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionAttemptHandlerTest {

    private FakeWebSocketConnector connector;
    private RecordingObservabilitySink sink;
    private ConnectionAttemptHandler handler;

    @BeforeEach
    void setUp() {
        connector = new FakeWebSocketConnector();
        sink = new RecordingObservabilitySink();
        handler = new ConnectionAttemptHandler(connector, config(), sink);
    }

    @Test
    void requestCarriesConfiguredEndpointAndTimeouts() {
        connector.enqueueSuccess();

        handler.attempt();

        ConnectRequest request = connector.requests().get(0);
        assertEquals("example.test", request.host());
        assertEquals(443, request.port());
        assertEquals("/stream", request.path());
        assertEquals("test-agent/1.0", request.userAgent());
        assertTrue(request.secure());
        assertEquals(Duration.ofSeconds(3), request.connectTimeout());
        assertEquals(Duration.ofSeconds(4), request.writeTimeout());
    }

    @Test
    void failureNamesStageAndCountsAttempts() {
        connector.enqueueFailure(AttemptStage.RESOLVE);
        connector.enqueueFailure(AttemptStage.HANDSHAKE);

        ConnectResult first = handler.attempt();
        ConnectResult second = handler.attempt();

        assertEquals(AttemptStage.RESOLVE, ((ConnectResult.Failed) first).stage());
        assertEquals(AttemptStage.HANDSHAKE, ((ConnectResult.Failed) second).stage());
        assertEquals(2, handler.consecutiveAttempts());
        assertEquals(2, sink.count(ClientErrorEvent.Kind.ATTEMPT_FAILURE));
        assertTrue(sink.getErrors().get(1).message().contains("HANDSHAKE"));
    }

    @Test
    void successResetsAttemptCount() {
        connector.enqueueFailure(AttemptStage.CONNECT);
        FakeWebSocketConnection connection = connector.enqueueSuccess();

        handler.attempt();
        ConnectResult result = handler.attempt();

        assertSame(connection, ((ConnectResult.Connected) result).connection());
        assertEquals(0, handler.consecutiveAttempts());
        assertEquals(2, sink.count(ConnectionEvent.Kind.CONNECTING));
        assertEquals(1, sink.count(ConnectionEvent.Kind.CONNECTED));
    }

    @Test
    void connectorExceptionBecomesFailedResult() {
        connector.enqueue(() -> {
            throw new IllegalStateException("connector bug");
        });

        ConnectResult result = handler.attempt();

        ConnectResult.Failed failed = assertInstanceOf(ConnectResult.Failed.class, result);
        assertEquals(AttemptStage.CONNECT, failed.stage());
        assertEquals("connector bug", failed.cause().getMessage());
    }

    @Test
    void nullResultBecomesFailedResult() {
        connector.enqueue(() -> null);

        assertInstanceOf(ConnectResult.Failed.class, handler.attempt());
    }

    private static ClientConfig config() {
        return ClientConfig.builder()
            .withHost("example.test")
            .withPort("443")
            .withPath("/stream")
            .withCallback(payload -> { })
            .withUserAgent("test-agent/1.0")
            .withSecure(true)
            .withRetryPolicy(RetryPolicy.defaults()
                .withConnectTimeout(Duration.ofSeconds(3))
                .withWriteTimeout(Duration.ofSeconds(4)))
            .build();
    }
}
