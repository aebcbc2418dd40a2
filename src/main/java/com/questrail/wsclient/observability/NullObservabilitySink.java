package com.questrail.wsclient.observability;

/**
 * No-op implementation of ClientObservabilitySink.
 */
public final class NullObservabilitySink implements ClientObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ClientStateTransitionEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onError(ClientErrorEvent event) {}
}
