package com.questrail.wsclient.transport;

/**
 * The step of a connection attempt that failed.
 */
public enum AttemptStage
{
    /** Host name lookup. */
    RESOLVE,

    /** TCP (and TLS) connect to every resolved endpoint. */
    CONNECT,

    /** WebSocket opening handshake. */
    HANDSHAKE
}
