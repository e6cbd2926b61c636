package io.trading.rofex.client.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.timeout.IdleStateHandler;
import io.trading.rofex.client.config.SessionConfig;
import io.trading.rofex.client.error.TransportException;
import io.trading.rofex.client.stream.StreamTransport;
import io.trading.rofex.client.stream.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Netty-based WebSocket connection to the streaming endpoint.
 * Supports both epoll (Linux) and NIO event loop groups; one single-threaded group per connection.
 */
public class NettyStreamTransport implements StreamTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyStreamTransport.class);

    private static final int MAX_HTTP_CONTENT_LENGTH = 8192;
    private static final int MAX_FRAME_PAYLOAD_LENGTH = 1024 * 1024;

    private final String name;
    private final SessionConfig config;

    private EventLoopGroup eventLoopGroup;
    private volatile Channel channel;
    private volatile CompletableFuture<Void> handshakeFuture;
    private volatile boolean closed = false;

    public NettyStreamTransport(String name, SessionConfig config) {
        this.name = name;
        this.config = config;
    }

    @Override
    public CompletableFuture<Void> open(URI uri, Map<String, String> headers, TransportListener listener) {
        if (handshakeFuture != null) {
            throw new IllegalStateException(name + ": transport already opened");
        }
        CompletableFuture<Void> handshake = new CompletableFuture<>();
        handshakeFuture = handshake;

        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);

        SslContext sslContext = null;
        if (secure) {
            try {
                sslContext = SslContextBuilder.forClient()
                    .protocols("TLSv1.2", "TLSv1.3")
                    .sslProvider(SslProvider.JDK)
                    .build();
            } catch (SSLException e) {
                handshake.completeExceptionally(new TransportException(name + ": failed to create SSL context", e));
                return handshake;
            }
        }

        HttpHeaders upgradeHeaders = new DefaultHttpHeaders();
        headers.forEach(upgradeHeaders::add);

        SslContext ssl = sslContext;
        eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, name + "-netty");
        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(config.loginTimeoutMs(), Integer.MAX_VALUE))
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();

                    if (ssl != null) {
                        pipeline.addLast(ssl.newHandler(ch.alloc(), host, port));
                    }

                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT_LENGTH));

                    if (config.enableCompression()) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }

                    if (config.pingIntervalSeconds() > 0) {
                        pipeline.addLast(new IdleStateHandler(0, 0, config.pingIntervalSeconds(), TimeUnit.SECONDS));
                    }

                    pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_PAYLOAD_LENGTH));
                    pipeline.addLast(new WebSocketClientHandler(
                        name, uri, upgradeHeaders, MAX_FRAME_PAYLOAD_LENGTH, listener, handshake));
                }
            });

        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
        ChannelFuture connectFuture = bootstrap.connect(host, port);
        channel = connectFuture.channel();
        connectFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                handshake.completeExceptionally(new TransportException(
                    name + ": failed to connect to " + host + ":" + port + ": " + future.cause().getMessage(),
                    future.cause()));
            }
        });
        return handshake;
    }

    @Override
    public void send(String text) {
        if (!isOpen()) {
            throw new TransportException(name + ": cannot send, not connected");
        }
        // write failures surface through exceptionCaught and close the channel
        channel.writeAndFlush(new TextWebSocketFrame(text))
            .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public boolean isOpen() {
        Channel current = channel;
        CompletableFuture<Void> handshake = handshakeFuture;
        return !closed
            && current != null
            && current.isActive()
            && handshake != null
            && handshake.isDone()
            && !handshake.isCompletedExceptionally();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        boolean upgraded = isOpen();
        closed = true;

        CompletableFuture<Void> handshake = handshakeFuture;
        if (handshake != null) {
            handshake.completeExceptionally(new TransportException(name + ": transport closed"));
        }

        Channel current = channel;
        if (current != null) {
            try {
                if (upgraded) {
                    current.writeAndFlush(new CloseWebSocketFrame());
                }
                current.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.error("{}: Interrupted while closing channel", name, e);
            }
            channel = null;
        }

        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            eventLoopGroup = null;
        }

        LOGGER.info("{}: Closed", name);
    }
}
