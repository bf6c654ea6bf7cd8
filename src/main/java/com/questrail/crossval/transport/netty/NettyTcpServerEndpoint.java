package com.questrail.crossval.transport.netty;

import com.questrail.crossval.api.SetupException;
import com.questrail.crossval.io.ProtocolViolationException;
import com.questrail.crossval.transport.ConnectionId;
import com.questrail.crossval.transport.StreamServerEndpoint;
import com.questrail.crossval.transport.StreamServerListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyTcpServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamServerEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames records,
 * tracks connections and writes bytes. It MUST NOT decode records or make
 * protocol decisions.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Threading</h2>
 * One {@link NioEventLoopGroup} thread named {@code crossval-coordinator}
 * accepts connections and performs all I/O. Every listener callback runs on
 * that thread, in order.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds synchronously and reports the bound address.
 * - {@link #stop()} closes everything with no quiet period. The endpoint
 *   cannot be restarted; build a new one.
 */
public final class NettyTcpServerEndpoint implements StreamServerEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpServerEndpoint.class);

    static final String THREAD_NAME = "crossval-coordinator";

    private static final long STOP_WAIT_MILLIS = 2_000;

    private final InetSocketAddress bindAddress;
    private final int recordSize;

    private final EventLoopGroup group;
    private final ServerBootstrap bootstrap;

    private final Map<ConnectionId, Channel> connections = new ConcurrentHashMap<>();
    private final AtomicLong nextConnectionId = new AtomicLong(1);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile StreamServerListener listener;
    private volatile Channel serverChannel;

    /**
     * Construct an endpoint that will listen on {@code bindAddress} and frame
     * inbound bytes into records of {@code recordSize} bytes.
     */
    public NettyTcpServerEndpoint(InetSocketAddress bindAddress, int recordSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (recordSize <= 0) {
            throw new IllegalArgumentException("recordSize must be positive");
        }
        this.recordSize = recordSize;

        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory(THREAD_NAME, true));
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(group)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new RecordFrameDecoder(NettyTcpServerEndpoint.this.recordSize));
                        p.addLast(new ConnectionHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamServerListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public InetSocketAddress start() throws SetupException
    {
        if (listener == null) {
            throw new IllegalStateException("StreamServerListener must be set before start()");
        }
        if (stopped.get() || !started.compareAndSet(false, true)) {
            throw new IllegalStateException("endpoint already started");
        }

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw new SetupException("Failed to listen on " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
        log.info("Coordinator listening on {}", bound);
        return bound;
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel server = serverChannel;
        if (server != null) {
            server.close();
        }
        for (Channel ch : connections.values()) {
            ch.close();
        }
        connections.clear();

        Future<?> termination = group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
        if (!group.next().inEventLoop()) {
            if (!termination.awaitUninterruptibly(STOP_WAIT_MILLIS)) {
                log.warn("Coordinator event loop did not terminate within {} ms", STOP_WAIT_MILLIS);
            }
        }
        log.info("Coordinator endpoint stopped");
    }

    @Override
    public CompletionStage<Void> send(ConnectionId connection, byte[] record)
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(record, "record");

        CompletableFuture<Void> written = new CompletableFuture<>();
        Channel ch = connections.get(connection);
        if (ch == null) {
            written.completeExceptionally(new ClosedChannelException());
            return written;
        }

        ch.writeAndFlush(Unpooled.wrappedBuffer(record)).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            }
            else {
                written.completeExceptionally(future.cause());
            }
        });
        return written;
    }

    @Override
    public void close(ConnectionId connection)
    {
        Channel ch = connections.get(Objects.requireNonNull(connection, "connection"));
        if (ch != null) {
            ch.close();
        }
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One instance per accepted connection. Assigns the connection identity,
     * forwards framed records and reports exactly one close.
     */
    private final class ConnectionHandler extends ChannelInboundHandlerAdapter
    {
        private ConnectionId id;
        private Throwable closeCause;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            id = new ConnectionId(nextConnectionId.getAndIncrement());
            connections.put(id, ctx.channel());
            log.debug("Accepted {} from {}", id, ctx.channel().remoteAddress());
            if (!stopped.get()) {
                listener.onConnectionOpened(id);
            }
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            if (msg instanceof byte[] record) {
                if (!stopped.get()) {
                    listener.onRecord(id, record);
                }
            }
            else if (msg instanceof TruncatedRecord t) {
                closeCause = new ProtocolViolationException(
                        "Peer closed after " + t.bufferedBytes() + " of " + recordSize + " record bytes");
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (id == null) {
                return;
            }
            connections.remove(id);
            if (!stopped.get()) {
                listener.onConnectionClosed(id, closeCause);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (closeCause == null) {
                closeCause = cause;
            }
            ctx.close();
        }
    }
}
