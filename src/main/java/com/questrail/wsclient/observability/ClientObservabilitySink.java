package com.questrail.wsclient.observability;

/**
 * Main interface for receiving client observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called from caller threads, the I/O loop thread and the
 * reconnect thread, sometimes while the client's state lock is held.
 * Implementations must be thread-safe, must not block, and must never call
 * back into the client.</p>
 */
public interface ClientObservabilitySink {
    /**
     * Called when the coarse client status changes.
     * @param event the transition event details
     */
    void onStateTransition(ClientStateTransitionEvent event);

    /**
     * Called for connection lifecycle milestones (attempt, connect, retry, stop).
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called when a recoverable failure occurs.
     * @param event the error event
     */
    void onError(ClientErrorEvent event);
}
