package com.questrail.wsclient.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ClientObservabilitySink that emits logs via SLF4J.
 *
 * <p>Connection failures are expected while a server is down and are retried
 * forever, so they are logged at WARN with the cause's message only. Full stack
 * traces are reserved for failures of the client itself.</p>
 */
public final class Slf4jClientObservabilitySink implements ClientObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jClientObservabilitySink.class);

    @Override
    public void onStateTransition(ClientStateTransitionEvent event) {
        log.info("WebSocket client: {} -> {}", event.oldStatus(), event.newStatus());
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        switch (event.kind()) {
            case QUEUE_RETRY_SCHEDULED, LOOP_EXITED -> log.debug("WebSocket {}: {}", event.kind(), event.detail());
            default -> log.info("WebSocket {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(ClientErrorEvent event) {
        switch (event.kind()) {
            case ATTEMPT_FAILURE, READ_FAULT, WRITE_FAILURE ->
                log.warn("WebSocket {}: {} ({})", event.kind(), event.message(), describe(event.cause()));
            default -> log.error("WebSocket {}: {}", event.kind(), event.message(), event.cause());
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "no cause";
        }
        return cause.getMessage() != null
            ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
            : cause.getClass().getSimpleName();
    }
}
