package io.trading.rofex.client.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for Netty event loop groups.
 * Uses epoll on Linux when the native transport is on the classpath, NIO elsewhere.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);

    private static final boolean EPOLL_AVAILABLE = isEpollOnClasspath() && Epoll.isAvailable();

    static {
        LOGGER.info("Netty: using {} transport", EPOLL_AVAILABLE ? "native epoll" : "NIO");
    }

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an EventLoopGroup whose threads are named after the owner.
     *
     * @param threads Number of threads
     * @param name    Thread name prefix
     */
    public static EventLoopGroup createEventLoopGroup(int threads, String name) {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory(name, true);
        if (EPOLL_AVAILABLE) {
            return new EpollEventLoopGroup(threads, threadFactory);
        }
        return new NioEventLoopGroup(threads, threadFactory);
    }

    public static Class<? extends SocketChannel> getClientChannelClass() {
        return EPOLL_AVAILABLE ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    // the native transport is an optional dependency
    private static boolean isEpollOnClasspath() {
        try {
            Class.forName("io.netty.channel.epoll.Epoll", false, NettyEventLoopFactory.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException e) {
            LOGGER.debug("Netty epoll classes not found, falling back to NIO");
            return false;
        }
    }
}
