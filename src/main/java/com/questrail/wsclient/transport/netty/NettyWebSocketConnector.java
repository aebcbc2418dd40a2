package com.questrail.wsclient.transport.netty;

import com.questrail.wsclient.transport.AttemptStage;
import com.questrail.wsclient.transport.ConnectRequest;
import com.questrail.wsclient.transport.ConnectResult;
import com.questrail.wsclient.transport.WebSocketConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyWebSocketConnector
 * =============================================================================
 * Netty-backed implementation of the {@link WebSocketConnector} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It resolves, connects
 * and performs the opening handshake, and it MUST NOT:
 * <ul>
 *   <li>Retry a failed attempt</li>
 *   <li>Reconnect a dropped connection</li>
 *   <li>Buffer outbound messages</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Timeout</h2>
 * {@link ConnectRequest#connectTimeout()} bounds the whole attempt, from
 * resolution through the handshake. Time spent on one unreachable address is
 * not available to the next one.
 *
 * <h2>Resources</h2>
 * Every attempt gets its own single-threaded {@link NioEventLoopGroup}. It is
 * shut down when the attempt fails, or when the resulting connection's channel
 * closes.
 */
public final class NettyWebSocketConnector implements WebSocketConnector
{
    /**
     * Host name lookup, replaceable for tests.
     */
    @FunctionalInterface
    public interface HostResolver
    {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private static final int HANDSHAKE_RESPONSE_MAX_LENGTH = 8192;

    private final ThreadFactory threadFactory;
    private final HostResolver resolver;

    public NettyWebSocketConnector(ThreadFactory threadFactory)
    {
        this(threadFactory, InetAddress::getAllByName);
    }

    public NettyWebSocketConnector(ThreadFactory threadFactory, HostResolver resolver)
    {
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public ConnectResult connect(ConnectRequest request)
    {
        Objects.requireNonNull(request, "request");
        final long deadline = System.nanoTime() + request.connectTimeout().toNanos();

        // 1. Resolve
        final InetAddress[] addresses;
        try {
            addresses = resolver.resolve(request.host());
        } catch (UnknownHostException | SecurityException e) {
            return new ConnectResult.Failed(AttemptStage.RESOLVE, e);
        }
        if (addresses == null || addresses.length == 0) {
            return new ConnectResult.Failed(AttemptStage.RESOLVE,
                new UnknownHostException("no addresses for " + request.host()));
        }

        final SslContext sslContext;
        try {
            sslContext = request.secure() ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            return new ConnectResult.Failed(AttemptStage.CONNECT, e);
        }

        EventLoopGroup group = new NioEventLoopGroup(1, threadFactory);
        URI uri = uriFor(request);

        // 2. Connect, trying resolved endpoints in order until the deadline
        NettyWebSocketConnection connection = null;
        Channel channel = null;
        Throwable lastFailure = null;
        for (InetAddress address : addresses) {
            long remaining = remainingMillis(deadline);
            if (remaining <= 0) {
                lastFailure = attemptTimeout(request, "before connecting to " + address);
                break;
            }
            NettyWebSocketConnection candidate = new NettyWebSocketConnection(handshakerFor(uri, request),
                request.writeTimeout());
            ChannelFuture connected = bootstrap(group, remaining, sslContext, request, candidate)
                .connect(new InetSocketAddress(address, request.port()));

            if (!connected.awaitUninterruptibly(remaining)) {
                connected.channel().close();
                lastFailure = attemptTimeout(request, "connecting to " + address);
                continue;
            }
            if (!connected.isSuccess()) {
                connected.channel().close();
                lastFailure = connected.cause();
                continue;
            }
            connection = candidate;
            channel = connected.channel();
            break;
        }
        if (connection == null) {
            shutdown(group);
            return new ConnectResult.Failed(AttemptStage.CONNECT, lastFailure);
        }

        // 3. Handshake, within what is left of the deadline
        ChannelFuture handshake = connection.handshakeFuture();
        long remaining = remainingMillis(deadline);
        boolean done = remaining > 0 && handshake.awaitUninterruptibly(remaining);
        if (!done || !handshake.isSuccess()) {
            channel.close();
            shutdown(group);
            Throwable cause = done
                ? handshake.cause()
                : attemptTimeout(request, "during the handshake");
            return new ConnectResult.Failed(AttemptStage.HANDSHAKE, cause);
        }

        channel.closeFuture().addListener(f -> shutdown(group));
        return new ConnectResult.Connected(connection);
    }

    private static Bootstrap bootstrap(EventLoopGroup group,
                                       long connectTimeoutMillis,
                                       SslContext sslContext,
                                       ConnectRequest request,
                                       NettyWebSocketConnection connection)
    {
        return new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(connectTimeoutMillis, Integer.MAX_VALUE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), request.host(), request.port()));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(HANDSHAKE_RESPONSE_MAX_LENGTH));
                        p.addLast(new WebSocketFrameAggregator(request.maxFramePayloadLength()));
                        p.addLast(connection);
                    }
                });
    }

    private static WebSocketClientHandshaker handshakerFor(URI uri, ConnectRequest request)
    {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.set(HttpHeaderNames.USER_AGENT, request.userAgent());
        return WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, headers, request.maxFramePayloadLength());
    }

    static URI uriFor(ConnectRequest request)
    {
        String host = request.host();
        if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return URI.create((request.secure() ? "wss" : "ws") + "://" + host + ":" + request.port() + request.path());
    }

    private static long remainingMillis(long deadline)
    {
        return TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
    }

    private static TimeoutException attemptTimeout(ConnectRequest request, String where)
    {
        return new TimeoutException("attempt exceeded " + request.connectTimeout() + " " + where);
    }

    private static void shutdown(EventLoopGroup group)
    {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
}
