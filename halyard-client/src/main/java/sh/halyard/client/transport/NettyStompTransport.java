// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client.transport;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.net.ssl.SSLException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.halyard.client.StompClientConfig;
import sh.halyard.core.error.StompConnectionException;

/**
 * TCP transport built on a Netty {@link Bootstrap}, optionally wrapped in TLS.
 *
 * <p>Each transport pins its channel and timers to a single event loop taken
 * from the group, which makes that loop the connection's {@link StompReactor}.
 * If the group was created here it is shut down by {@link #close()}; an
 * externally supplied group is left running.
 */
public final class NettyStompTransport implements StompTransport {

    private static final Logger log = LoggerFactory.getLogger(NettyStompTransport.class);

    private final EventLoopGroup group;
    /** True if we created the EventLoopGroup internally and are responsible for shutting it down. */
    private final boolean ownsEventLoopGroup;
    private final Class<? extends Channel> channelClass;
    private final NettyReactor reactor;
    private final int connectTimeoutMillis;
    private final @Nullable SslContext sslContext;

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile @Nullable Channel channel;

    public NettyStompTransport(final StompClientConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.eventLoopGroup() != null) {
            this.group = config.eventLoopGroup();
            this.channelClass = detectChannelClass(config.eventLoopGroup());
            this.ownsEventLoopGroup = false;
        } else {
            TransportSelection transport = selectTransport(config.transportType(), config.ioThreads());
            this.group = transport.group;
            this.channelClass = transport.channelClass;
            this.ownsEventLoopGroup = true;
        }
        this.reactor = new NettyReactor(group.next());
        this.connectTimeoutMillis = (int) config.connectTimeout().toMillis();
        this.sslContext = config.tls() ? buildSslContext() : null;
    }

    @Override
    public StompReactor reactor() {
        return reactor;
    }

    @Override
    public void connect(final String host, final int port, final TransportListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (closed.get()) {
            throw new StompConnectionException("Transport is closed");
        }
        Bootstrap bootstrap = new Bootstrap()
                .group(reactor.eventLoop())
                .channel(channelClass)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new InboundHandler(listener));
                    }
                });

        log.debug("Opening {} to {}:{}", channelClass.getSimpleName(), host, port);
        bootstrap.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                listener.onConnectFailed(future.cause());
                return;
            }
            Channel ch = future.channel();
            if (closed.get()) {
                ch.close();
                return;
            }
            channel = ch;
            listener.onConnected();
        });
    }

    @Override
    public void write(final byte[] data) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            log.debug("Dropping {} byte write: channel is not active", data.length);
            return;
        }
        ch.writeAndFlush(Unpooled.wrappedBuffer(data))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Channel ch = channel;
        if (ch != null && ch.isOpen()) {
            // flush whatever is queued, then close
            ch.closeFuture().addListener((ChannelFutureListener) f -> shutdownGroup());
            ch.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        } else {
            shutdownGroup();
        }
    }

    private void shutdownGroup() {
        // Only shutdown the EventLoopGroup if we created it internally
        if (ownsEventLoopGroup && !group.isShuttingDown()) {
            log.debug("Shutting down owned event loop group");
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

    private static SslContext buildSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new StompConnectionException("Failed to initialise TLS context", e);
        }
    }

    /**
     * Forwards inbound bytes and reports the first failure or peer close of the
     * channel, unless the transport was closed locally.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf> {

        private final TransportListener listener;
        private boolean reported;

        InboundHandler(final TransportListener listener) {
            this.listener = listener;
        }

        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, final ByteBuf msg) {
            if (!closed.get()) {
                listener.onRead(msg);
            }
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
            report(new StompConnectionException("Connection closed by broker"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.debug("Channel error on {}", ctx.channel(), cause);
            report(cause);
            ctx.close();
        }

        private void report(final Throwable cause) {
            if (reported || closed.get()) {
                return;
            }
            reported = true;
            listener.onError(cause);
        }
    }

    // ==================== Native Transport Support ====================

    private record TransportSelection(EventLoopGroup group, Class<? extends Channel> channelClass) {}

    /**
     * Builds the event loop group for the configured transport. AUTO resolves to
     * Epoll, then KQueue, then NIO; an explicit native type must be available.
     */
    private static TransportSelection selectTransport(final StompClientConfig.TransportType type, final int ioThreads) {
        StompClientConfig.TransportType resolved = type == StompClientConfig.TransportType.AUTO ? nativeOrNio() : type;
        if (type != StompClientConfig.TransportType.AUTO) {
            requireAvailable(type);
        }
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "halyard-netty-io");
            t.setDaemon(true);
            return t;
        };
        log.debug("Using {} transport (requested {})", resolved, type);
        return switch (resolved) {
            case EPOLL -> new TransportSelection(
                    new io.netty.channel.epoll.EpollEventLoopGroup(ioThreads, threadFactory),
                    io.netty.channel.epoll.EpollSocketChannel.class);
            case KQUEUE -> new TransportSelection(
                    new io.netty.channel.kqueue.KQueueEventLoopGroup(ioThreads, threadFactory),
                    io.netty.channel.kqueue.KQueueSocketChannel.class);
            case NIO, AUTO -> new TransportSelection(
                    new io.netty.channel.nio.NioEventLoopGroup(ioThreads, threadFactory),
                    NioSocketChannel.class);
        };
    }

    private static StompClientConfig.TransportType nativeOrNio() {
        if (io.netty.channel.epoll.Epoll.isAvailable()) {
            return StompClientConfig.TransportType.EPOLL;
        }
        if (io.netty.channel.kqueue.KQueue.isAvailable()) {
            return StompClientConfig.TransportType.KQUEUE;
        }
        return StompClientConfig.TransportType.NIO;
    }

    private static void requireAvailable(final StompClientConfig.TransportType type) {
        Throwable cause = switch (type) {
            case EPOLL -> io.netty.channel.epoll.Epoll.unavailabilityCause();
            case KQUEUE -> io.netty.channel.kqueue.KQueue.unavailabilityCause();
            case NIO, AUTO -> null;
        };
        if (cause != null) {
            throw new IllegalStateException(type + " transport requested but not available: " + cause.getMessage());
        }
    }

    /**
     * Channel class matching an externally provided group.
     */
    private static Class<? extends Channel> detectChannelClass(final EventLoopGroup group) {
        if (group instanceof io.netty.channel.epoll.EpollEventLoopGroup) {
            return io.netty.channel.epoll.EpollSocketChannel.class;
        }
        if (group instanceof io.netty.channel.kqueue.KQueueEventLoopGroup) {
            return io.netty.channel.kqueue.KQueueSocketChannel.class;
        }
        return NioSocketChannel.class;
    }
}
