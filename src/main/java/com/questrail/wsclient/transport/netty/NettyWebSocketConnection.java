package com.questrail.wsclient.transport.netty;

import com.questrail.wsclient.transport.ReadHandler;
import com.questrail.wsclient.transport.ReadOutcome;
import com.questrail.wsclient.transport.WebSocketConnection;
import com.questrail.wsclient.transport.WriteResult;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * NettyWebSocketConnection
 * =============================================================================
 * One Netty channel carrying one WebSocket, exposed as a {@link WebSocketConnection}.
 *
 * <p>This class is both the last handler in the channel pipeline and the
 * connection handed to the client. Netty types do not escape it: inbound frames
 * become {@code String} payloads inside {@link ReadOutcome} values.</p>
 *
 * <h2>Read demand</h2>
 * Once the handshake completes, auto-read is switched off. A frame is pulled
 * from the socket only when the client asks for one through
 * {@link #read(ReadHandler)}; frames that arrive in the same socket read are
 * buffered until requested.
 *
 * <h2>End of stream</h2>
 * The first terminal outcome wins and is repeated for every later read:
 * {@link ReadOutcome.Cancelled} when {@link #closeAsync()} was called first,
 * {@link ReadOutcome.Failed} for a peer close frame, a dropped socket or a
 * pipeline exception.
 */
final class NettyWebSocketConnection extends SimpleChannelInboundHandler<Object>
        implements WebSocketConnection {

    private final WebSocketClientHandshaker handshaker;
    private final Duration writeTimeout;

    private volatile Channel channel;
    private volatile ChannelPromise handshakeFuture;
    private volatile boolean closeRequested;

    // guarded by this
    private final Deque<ReadOutcome> inbound = new ArrayDeque<>();
    private ReadHandler pendingRead;
    private ReadOutcome terminal;

    NettyWebSocketConnection(WebSocketClientHandshaker handshaker, Duration writeTimeout) {
        this.handshaker = Objects.requireNonNull(handshaker, "handshaker");
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
    }

    ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    // -------------------------------------------------------------------------
    // WebSocketConnection
    // -------------------------------------------------------------------------

    @Override
    public void read(ReadHandler handler) {
        Objects.requireNonNull(handler, "handler");
        ReadOutcome ready;
        synchronized (this) {
            if (pendingRead != null) {
                throw new IllegalStateException("a read is already outstanding");
            }
            ready = inbound.pollFirst();
            if (ready == null) {
                ready = terminal;
            }
            if (ready == null) {
                pendingRead = handler;
            }
        }

        if (ready != null) {
            handler.onReadComplete(ready);
            return;
        }
        Channel ch = channel;
        if (ch != null) {
            ch.read();
        }
    }

    @Override
    public WriteResult write(String payload) {
        Objects.requireNonNull(payload, "payload");
        Channel ch = channel;
        if (ch == null || !isOpen()) {
            return WriteResult.failed(new ClosedChannelException());
        }

        ChannelFuture future = ch.writeAndFlush(new TextWebSocketFrame(payload));
        if (!future.awaitUninterruptibly(writeTimeout.toMillis())) {
            return WriteResult.failed(new TimeoutException("write did not complete within " + writeTimeout));
        }
        return future.isSuccess() ? WriteResult.written() : WriteResult.failed(future.cause());
    }

    @Override
    public void closeAsync() {
        if (closeRequested) {
            return;
        }
        closeRequested = true;

        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (ch.isActive() && handshaker.isHandshakeComplete()) {
            ch.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                .addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    @Override
    public boolean isOpen() {
        Channel ch = channel;
        if (ch == null || !ch.isActive() || closeRequested || !handshaker.isHandshakeComplete()) {
            return false;
        }
        synchronized (this) {
            return terminal == null;
        }
    }

    // -------------------------------------------------------------------------
    // Channel handler
    // -------------------------------------------------------------------------

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        channel = ctx.channel();
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                ctx.channel().config().setAutoRead(false);
                handshakeFuture.setSuccess();
            } catch (WebSocketHandshakeException e) {
                handshakeFuture.setFailure(e);
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException("Unexpected HTTP response after handshake (status="
                + response.status() + ")");
        }
        if (!(msg instanceof WebSocketFrame frame)) {
            return;
        }

        if (frame instanceof TextWebSocketFrame text) {
            deliver(new ReadOutcome.Message(text.text()));
        } else if (frame instanceof BinaryWebSocketFrame binary) {
            deliver(new ReadOutcome.Message(binary.content().toString(StandardCharsets.UTF_8)));
        } else if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof CloseWebSocketFrame close) {
            terminate(closeRequested
                ? ReadOutcome.CANCELLED
                : new ReadOutcome.Failed(new IOException("closed by peer: "
                    + close.statusCode() + " " + close.reasonText())));
            ctx.close();
        }
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) {
        // A socket read may end mid-frame; keep pulling while a read is outstanding.
        boolean wanted;
        synchronized (this) {
            wanted = pendingRead != null;
        }
        if (wanted && handshaker.isHandshakeComplete()) {
            ctx.read();
        }
        ctx.fireChannelReadComplete();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(new ClosedChannelException());
        }
        terminate(closeRequested ? ReadOutcome.CANCELLED : new ReadOutcome.Failed(new ClosedChannelException()));
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(cause);
        }
        terminate(closeRequested ? ReadOutcome.CANCELLED : new ReadOutcome.Failed(cause));
        ctx.close();
    }

    private void deliver(ReadOutcome outcome) {
        ReadHandler handler;
        synchronized (this) {
            if (terminal != null) {
                return;
            }
            handler = pendingRead;
            pendingRead = null;
            if (handler == null) {
                inbound.addLast(outcome);
                return;
            }
        }
        handler.onReadComplete(outcome);
    }

    private void terminate(ReadOutcome outcome) {
        ReadHandler handler;
        synchronized (this) {
            if (terminal != null) {
                return;
            }
            terminal = outcome;
            handler = pendingRead;
            pendingRead = null;
        }
        if (handler != null) {
            handler.onReadComplete(outcome);
        }
    }
}
