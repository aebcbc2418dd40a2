package com.questrail.wsclient.config;

import com.questrail.wsclient.api.MessageCallback;

import java.util.Objects;

/**
 * Immutable settings for one client: where to connect and whom to hand
 * inbound messages to.
 *
 * <p>The port is carried as text, the way it is usually configured, and is
 * validated as a numeric TCP port (1-65535) on construction. Service names
 * such as {@code "https"} are rejected rather than looked up; pass the number
 * instead.</p>
 */
public record ClientConfig(
    String host,
    String port,
    String path,
    MessageCallback callback,
    String userAgent,
    boolean secure,
    int maxFramePayloadLength,
    RetryPolicy retryPolicy
) {
    public static final String DEFAULT_USER_AGENT = "resilient-websocket-client";
    public static final int DEFAULT_MAX_FRAME_PAYLOAD_LENGTH = 65536;

    public ClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(port, "port");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(retryPolicy, "retryPolicy");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        parsePort(port);
        if (path.isEmpty()) {
            path = "/";
        }
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be positive");
        }
    }

    /**
     * Returns the port as a number.
     */
    public int portNumber() {
        return parsePort(port);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parsePort(String port) {
        final int value;
        try {
            value = Integer.parseInt(port.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port is not a number: " + port, e);
        }
        if (value < 1 || value > 65535) {
            throw new IllegalArgumentException("port must be 1-65535: " + port);
        }
        return value;
    }

    public static final class Builder {
        private String host;
        private String port;
        private String path = "/";
        private MessageCallback callback;
        private String userAgent = DEFAULT_USER_AGENT;
        private boolean secure;
        private int maxFramePayloadLength = DEFAULT_MAX_FRAME_PAYLOAD_LENGTH;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(String port) {
            this.port = port;
            return this;
        }

        public Builder withPort(int port) {
            this.port = Integer.toString(port);
            return this;
        }

        public Builder withPath(String path) {
            this.path = path;
            return this;
        }

        public Builder withCallback(MessageCallback callback) {
            this.callback = callback;
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder withSecure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder withMaxFramePayloadLength(int maxFramePayloadLength) {
            this.maxFramePayloadLength = maxFramePayloadLength;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(host, port, path, callback, userAgent, secure,
                    maxFramePayloadLength, retryPolicy);
        }
    }
}
