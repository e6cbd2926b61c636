package io.trading.rofex.client.netty;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.timeout.IdleStateEvent;
import io.trading.rofex.client.error.AuthenticationException;
import io.trading.rofex.client.error.TransportException;
import io.trading.rofex.client.stream.TransportListener;
import io.trading.rofex.protocol.error.RofexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Netty handler for the streaming connection.
 * Performs the authenticated upgrade, answers pings, pings on idle and forwards text frames.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final String name;
    private final WebSocketClientHandshaker handshaker;
    private final TransportListener listener;
    private final CompletableFuture<Void> handshakeFuture;

    public WebSocketClientHandler(
        String name,
        URI uri,
        HttpHeaders upgradeHeaders,
        int maxFramePayloadLength,
        TransportListener listener,
        CompletableFuture<Void> handshakeFuture
    ) {
        this.name = name;
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            upgradeHeaders,
            maxFramePayloadLength
        );
        this.listener = listener;
        this.handshakeFuture = handshakeFuture;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        listener.onConnected();
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: WebSocket channel inactive", name);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.completeExceptionally(
                new TransportException(name + ": connection closed during handshake"));
            return;
        }
        if (!handshakeFuture.isCompletedExceptionally()) {
            listener.onClosed();
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: WebSocket handshake complete", name);
                handshakeFuture.complete(null);
            } catch (WebSocketClientHandshakeException e) {
                LOGGER.warn("{}: WebSocket handshake rejected: {}", name, e.getMessage());
                handshakeFuture.completeExceptionally(toHandshakeFailure(e));
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof TextWebSocketFrame textFrame) {
            listener.onFrame(textFrame.text());
            return;
        }

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            LOGGER.trace("{}: Received pong", name);
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.info("{}: Received close frame ({} {})", name, close.statusCode(), close.reasonText());
            ctx.close();
            return;
        }

        LOGGER.warn("{}: Unsupported frame type: {}", name, frame.getClass().getName());
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent && handshaker.isHandshakeComplete()) {
            LOGGER.trace("{}: Idle, sending ping", name);
            ctx.writeAndFlush(new PingWebSocketFrame())
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("{}: WebSocket exception: {}", name, cause.getMessage());
        if (!handshakeFuture.isDone()) {
            handshakeFuture.completeExceptionally(
                new TransportException(name + ": handshake failed: " + cause.getMessage(), cause));
        } else {
            listener.onError(cause);
        }
        ctx.close();
    }

    private RofexException toHandshakeFailure(WebSocketClientHandshakeException e) {
        HttpResponse response = e.response();
        int status = response != null ? response.status().code() : -1;
        if (status == 401 || status == 403) {
            return new AuthenticationException(name + ": authentication rejected (HTTP " + status + ")", status, e);
        }
        return new TransportException(name + ": handshake failed: " + e.getMessage(), e);
    }
}
