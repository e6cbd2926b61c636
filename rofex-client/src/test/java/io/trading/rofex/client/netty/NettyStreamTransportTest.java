package io.trading.rofex.client.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.trading.rofex.client.config.SessionConfig;
import io.trading.rofex.client.error.AuthenticationException;
import io.trading.rofex.client.error.TransportException;
import io.trading.rofex.client.stream.TransportListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Transport tests against a local Netty WebSocket server that checks X-Auth-Token.
 */
class NettyStreamTransportTest {

    private static final String TOKEN = "token-1";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private NettyStreamTransport transport;

    private final List<String> serverReceived = new CopyOnWriteArrayList<>();
    private final RecordingListener listener = new RecordingListener();

    @BeforeEach
    void setUp() throws Exception {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
            .group(serverGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast(new HttpServerCodec());
                    ch.pipeline().addLast(new HttpObjectAggregator(65536));
                    ch.pipeline().addLast(new GatewayHandler());
                }
            })
            .bind(new InetSocketAddress("127.0.0.1", 0))
            .sync()
            .channel();

        transport = new NettyStreamTransport("test", SessionConfig.builder()
            .loginTimeoutMs(2000)
            .pingIntervalSeconds(0)
            .build());
    }

    @AfterEach
    void tearDown() throws Exception {
        transport.close();
        serverChannel.close().sync();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    private URI serverUri() {
        int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        return URI.create("ws://127.0.0.1:" + port + "/");
    }

    @Test
    void testHandshakeAndFramesBothWays() throws Exception {
        transport.open(serverUri(), Map.of("X-Auth-Token", TOKEN), listener)
            .get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

        assertTrue(transport.isOpen());
        assertEquals(1, listener.connected.get());

        transport.send("{\"type\":\"smd\"}");

        await().atMost(TIMEOUT).until(() -> listener.frames.size() == 1);
        assertEquals(List.of("{\"type\":\"smd\"}"), serverReceived);
        assertEquals("echo:{\"type\":\"smd\"}", listener.frames.get(0));
    }

    @Test
    void testRejectedTokenFailsWithAuthenticationException() {
        CompletableFuture<Void> handshake = transport.open(serverUri(), Map.of("X-Auth-Token", "expired"), listener);

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> handshake.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));

        AuthenticationException cause = assertInstanceOf(AuthenticationException.class, e.getCause());
        assertEquals(401, cause.getStatusCode());
        assertFalse(transport.isOpen());
        assertEquals(0, listener.closed.get());
    }

    @Test
    void testRefusedConnectionFailsWithTransportException() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        CompletableFuture<Void> handshake = transport.open(
            URI.create("ws://127.0.0.1:" + port + "/"), Map.of("X-Auth-Token", TOKEN), listener);

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> handshake.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    void testServerCloseNotifiesListener() throws Exception {
        transport.open(serverUri(), Map.of("X-Auth-Token", TOKEN), listener)
            .get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

        transport.send("bye");

        await().atMost(TIMEOUT).until(() -> listener.closed.get() == 1);
        assertFalse(transport.isOpen());
        assertThrows(TransportException.class, () -> transport.send("late"));
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        transport.open(serverUri(), Map.of("X-Auth-Token", TOKEN), listener)
            .get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

        transport.close();
        transport.close();

        assertFalse(transport.isOpen());
    }

    @Test
    void testOpenTwiceRejected() {
        transport.open(serverUri(), Map.of("X-Auth-Token", TOKEN), listener);

        assertThrows(IllegalStateException.class,
            () -> transport.open(serverUri(), Map.of("X-Auth-Token", TOKEN), listener));
    }

    private class GatewayHandler extends SimpleChannelInboundHandler<Object> {

        private WebSocketServerHandshaker handshaker;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest request) {
                if (!TOKEN.equals(request.headers().get("X-Auth-Token"))) {
                    FullHttpResponse response = new DefaultFullHttpResponse(
                        HttpVersion.HTTP_1_1, HttpResponseStatus.UNAUTHORIZED, Unpooled.EMPTY_BUFFER);
                    response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
                    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
                    return;
                }
                handshaker = new WebSocketServerHandshakerFactory(
                    "ws://" + request.headers().get(HttpHeaderNames.HOST) + "/", null, true)
                    .newHandshaker(request);
                handshaker.handshake(ctx.channel(), request);
                return;
            }

            WebSocketFrame frame = (WebSocketFrame) msg;
            if (frame instanceof CloseWebSocketFrame close) {
                handshaker.close(ctx.channel(), close.retain());
                return;
            }
            if (frame instanceof TextWebSocketFrame text) {
                serverReceived.add(text.text());
                if ("bye".equals(text.text())) {
                    ctx.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
                    return;
                }
                ctx.writeAndFlush(new TextWebSocketFrame("echo:" + text.text()));
            }
        }
    }

    private static class RecordingListener implements TransportListener {
        final AtomicInteger connected = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final List<String> frames = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onConnected() {
            connected.incrementAndGet();
        }

        @Override
        public void onFrame(String text) {
            frames.add(text);
        }

        @Override
        public void onClosed() {
            closed.incrementAndGet();
        }

        @Override
        public void onError(Throwable cause) {
            errors.add(cause);
        }
    }
}
