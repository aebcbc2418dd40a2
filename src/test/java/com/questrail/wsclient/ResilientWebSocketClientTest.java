package com.questrail.wsclient;

import com.questrail.wsclient.api.ClientStatus;
import com.questrail.wsclient.config.RetryPolicy;
import com.questrail.wsclient.loop.DeterministicIoLoop;
import com.questrail.wsclient.observability.ClientErrorEvent;
import com.questrail.wsclient.observability.ConnectionEvent;
import com.questrail.wsclient.observability.RecordingObservabilitySink;
import com.questrail.wsclient.transport.AttemptStage;
import com.questrail.wsclient.transport.ConnectResult;
import com.questrail.wsclient.transport.FakeWebSocketConnection;
import com.questrail.wsclient.transport.FakeWebSocketConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResilientWebSocketClientTest
 * -----------------------------------------------------------------------------
 * End-to-end tests of the client on its real threads, with a scripted transport.
 *
 * Note: These tests use real time with short retry delays. Waits are bounded
 * generously to avoid false failures on loaded systems.
 */
class ResilientWebSocketClientTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeWebSocketConnector connector;
    private RecordingObservabilitySink sink;
    private List<String> received;
    private ResilientWebSocketClient client;

    @BeforeEach
    void setUp() {
        connector = new FakeWebSocketConnector();
        sink = new RecordingObservabilitySink();
        received = new CopyOnWriteArrayList<>();
        client = builder().build();
    }

    @AfterEach
    void tearDown() {
        client.close();
        // Retired executor threads may still be unwinding.
        awaitCondition(() -> clientThreads().isEmpty());
    }

    @Test
    void builderValidatesConfiguration() {
        assertThrows(NullPointerException.class, () -> ResilientWebSocketClient.builder()
            .withPort("443").withCallback(received::add).build());
        assertThrows(IllegalArgumentException.class, () -> ResilientWebSocketClient.builder()
            .withHost("example.test").withPort("99999").withCallback(received::add).build());
        assertThrows(IllegalArgumentException.class, () -> ResilientWebSocketClient.builder()
            .withHost("example.test").withPort("https").withCallback(received::add).build());
    }

    @Test
    void stopWithoutStartIsNoOp() {
        client.stop();

        assertEquals(ClientStatus.STOPPED, client.status());
        assertTrue(clientThreads().isEmpty());
    }

    @Test
    void startConnectsAndDeliversMessagesOnLoopThread() throws InterruptedException {
        FakeWebSocketConnection connection = connector.enqueueSuccess();
        AtomicReference<String> callbackThread = new AtomicReference<>();
        CountDownLatch delivered = new CountDownLatch(1);
        client = builder()
            .withCallback(payload -> {
                callbackThread.set(Thread.currentThread().getName());
                received.add(payload);
                delivered.countDown();
            })
            .build();

        client.start();
        awaitCondition(connection::hasPendingRead);
        assertTrue(client.isConnected());
        assertEquals(ClientStatus.CONNECTED, client.status());

        connection.deliver("hello");

        assertTrue(delivered.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertEquals(List.of("hello"), received);
        assertTrue(callbackThread.get().startsWith(ResilientWebSocketClient.IO_LOOP_THREAD_NAME));
    }

    @Test
    void noBackgroundThreadRemainsAfterStartStopCycles() {
        for (int i = 0; i < 5; i++) {
            connector.enqueueSuccess();
            client.start();
            assertEquals(1, clientThreads().size(), "exactly one loop thread while started");
            client.stop();
        }

        awaitCondition(() -> clientThreads().isEmpty());
        assertEquals(5, sink.count(ConnectionEvent.Kind.STOPPED));
        assertFalse(client.controller().hasPendingTimers());
    }

    @Test
    void stopDuringRetryDelayLeavesNothingBehind() {
        client = builder().withRetryPolicy(fastRetry().withStartRetryDelay(Duration.ofSeconds(30))).build();

        client.start();
        awaitCondition(() -> client.status() == ClientStatus.WAITING_TO_RETRY);
        client.stop();

        assertEquals(1, connector.attempts());
        assertFalse(client.controller().hasPendingTimers());
        awaitCondition(() -> clientThreads().isEmpty());
    }

    @Test
    void queuedPingIsSentOnceRetrySucceeds() {
        connector.enqueueFailure(AttemptStage.RESOLVE);
        FakeWebSocketConnection connection = connector.enqueueSuccess();

        client.start();
        assertTrue(client.sendMessage("ping", true));

        awaitCondition(() -> connection.written().contains("ping"));
        assertEquals(0, client.pendingMessageCount());
        assertEquals(2, connector.attempts());
    }

    @Test
    void readFaultTriggersReconnectOnSeparateThread() {
        FakeWebSocketConnection first = connector.enqueueSuccess();
        FakeWebSocketConnection second = connector.enqueueSuccess();

        client.start();
        awaitCondition(first::hasPendingRead);
        first.breakConnection(new IOException("connection reset"));

        awaitCondition(second::hasPendingRead);
        assertEquals(ClientStatus.CONNECTED, client.status());
        assertEquals(1, sink.count(ConnectionEvent.Kind.RECONNECTING));
    }

    @Test
    void stopFromCallbackStopsTheClient() throws InterruptedException {
        FakeWebSocketConnection connection = connector.enqueueSuccess();
        AtomicReference<ResilientWebSocketClient> self = new AtomicReference<>();
        CountDownLatch stopped = new CountDownLatch(1);
        client = builder()
            .withCallback(payload -> {
                self.get().stop();
                stopped.countDown();
            })
            .build();
        self.set(client);

        client.start();
        awaitCondition(connection::hasPendingRead);
        connection.deliver("stop please");

        assertTrue(stopped.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertEquals(ClientStatus.STOPPED, client.status());
        assertFalse(connection.isOpen());
        awaitCondition(() -> clientThreads().isEmpty());
    }

    @Test
    void immediateSendWithoutConnectionReturnsFalse() {
        assertFalse(client.sendMessage("dropped"));
        assertFalse(client.sendMessage("dropped", false));
        assertEquals(0, client.pendingMessageCount());
    }

    @Test
    void nullPayloadIsRejected() {
        assertThrows(NullPointerException.class, () -> client.sendMessage(null));
        assertThrows(NullPointerException.class, () -> client.sendMessage(null, true));
    }

    @Test
    void closedClientCannotBeRestarted() {
        client.close();
        client.close();

        assertThrows(IllegalStateException.class, client::start);
        assertEquals(ClientStatus.STOPPED, client.status());
    }

    @Test
    void statusListenerSeesEveryTransition() {
        List<ClientStatus> statuses = new CopyOnWriteArrayList<>();
        FakeWebSocketConnection connection = connector.enqueueSuccess();
        client = builder().withStatusListener(statuses::add).build();

        client.start();
        awaitCondition(connection::hasPendingRead);
        client.stop();

        assertEquals(List.of(ClientStatus.CONNECTING, ClientStatus.CONNECTED, ClientStatus.STOPPED), statuses);
    }

    @Test
    void throwingStatusListenerIsReportedAndDoesNotEscapeStart() {
        FakeWebSocketConnection connection = connector.enqueueSuccess();
        client = builder()
            .withStatusListener(status -> {
                throw new IllegalStateException("listener failed on " + status);
            })
            .build();

        assertDoesNotThrow(client::start);

        awaitCondition(connection::hasPendingRead);
        assertEquals(ClientStatus.CONNECTED, client.status());
        assertTrue(sink.count(ClientErrorEvent.Kind.CALLBACK_FAILURE) >= 2);
        assertEquals(List.of(ClientStatus.CONNECTING, ClientStatus.CONNECTED), sink.getStatusSequence());
    }

    @Test
    void stopWhileAttemptBlocksLoopClosesTheLateConnection() throws InterruptedException {
        FakeWebSocketConnection late = new FakeWebSocketConnection();
        CountDownLatch attemptRunning = new CountDownLatch(1);
        CountDownLatch releaseAttempt = new CountDownLatch(1);
        connector.enqueue(() -> {
            attemptRunning.countDown();
            try {
                releaseAttempt.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ConnectResult.Connected(late);
        });

        client.start();
        assertTrue(attemptRunning.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));

        Thread stopper = new Thread(client::stop, "test-stopper");
        stopper.start();
        awaitCondition(() -> client.status() == ClientStatus.STOPPED);
        releaseAttempt.countDown();
        stopper.join(WAIT.toMillis());

        assertFalse(stopper.isAlive());
        assertEquals(1, late.closeCount());
        assertEquals(0, late.readCount());
        assertFalse(client.isConnected());
        assertFalse(client.controller().hasPendingTimers());
        awaitCondition(() -> clientThreads().isEmpty());
    }

    @Test
    void reconnectExecutorsAreShutDownOnStop() {
        List<ExecutorService> executors = new CopyOnWriteArrayList<>();
        client = builder()
            .withReconnectExecutorFactory(() -> {
                ExecutorService executor = Executors.newSingleThreadExecutor();
                executors.add(executor);
                return executor;
            })
            .build();

        client.start();
        client.stop();
        client.start();
        client.stop();

        assertEquals(2, executors.size());
        assertTrue(executors.stream().allMatch(ExecutorService::isTerminated));
    }

    @Test
    void injectedLoopRunsAttemptsOnlyWhenDriven() {
        DeterministicIoLoop loop = new DeterministicIoLoop();
        connector.enqueueSuccess();
        client = builder().withIoLoop(loop).build();

        client.start();
        assertEquals(0, connector.attempts());

        loop.runPending();
        assertEquals(1, connector.attempts());
        assertTrue(client.isConnected());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private ResilientWebSocketClient.Builder builder() {
        return ResilientWebSocketClient.builder()
            .withHost("example.test")
            .withPort("443")
            .withPath("/stream")
            .withCallback(received::add)
            .withRetryPolicy(fastRetry())
            .withConnector(connector)
            .withObservabilitySink(sink);
    }

    private static RetryPolicy fastRetry() {
        return RetryPolicy.defaults()
            .withStartRetryDelay(Duration.ofMillis(50))
            .withQueueRetryDelay(Duration.ofMillis(20))
            .withShutdownTimeout(Duration.ofSeconds(2));
    }

    private static List<Thread> clientThreads() {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(Thread::isAlive)
            .filter(t -> t.getName().startsWith(ResilientWebSocketClient.IO_LOOP_THREAD_NAME)
                || t.getName().startsWith(ResilientWebSocketClient.RECONNECT_THREAD_NAME))
            .toList();
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + WAIT);
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }
}
