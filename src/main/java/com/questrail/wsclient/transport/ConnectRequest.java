package com.questrail.wsclient.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything a {@link WebSocketConnector} needs for one attempt.
 *
 * @param host                  host name or address to resolve
 * @param port                  TCP port
 * @param path                  request target for the handshake
 * @param userAgent             value of the identifying {@code User-Agent} header
 * @param secure                whether to run TLS under the WebSocket
 * @param maxFramePayloadLength largest accepted inbound message
 * @param connectTimeout        bound for the whole attempt, resolution to handshake
 * @param writeTimeout          bound for one synchronous write on the connection
 */
public record ConnectRequest(
    String host,
    int port,
    String path,
    String userAgent,
    boolean secure,
    int maxFramePayloadLength,
    Duration connectTimeout,
    Duration writeTimeout
) {
    public ConnectRequest {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
    }
}
