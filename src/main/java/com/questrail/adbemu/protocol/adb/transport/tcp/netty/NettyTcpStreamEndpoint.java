package com.questrail.adbemu.protocol.adb.transport.tcp.netty;

import com.questrail.adbemu.protocol.adb.transport.EmulatorTransportException;
import com.questrail.adbemu.protocol.adb.transport.StreamConnection;
import com.questrail.adbemu.protocol.adb.transport.StreamConnectionListener;
import com.questrail.adbemu.protocol.adb.transport.StreamEndpoint;
import com.questrail.adbemu.protocol.adb.transport.StreamEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is the emulator's <strong>connection multiplexer</strong>: a
 * single readiness-driven loop that owns the listening socket and every
 * accepted connection. It is a pure transport adapter.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode connection-layer headers or sync frames</li>
 *   <li>Interpret protocol semantics</li>
 *   <li>Decide what to write back</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * One {@link NioEventLoopGroup} with exactly one thread serves as both the
 * acceptor and the worker group. Every socket, and every call into a
 * {@link StreamConnectionListener}, is therefore confined to that thread.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are copied into {@code byte[]}
 * chunks of exactly the size the listener requested.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds and returns once the listener is accepting.
 * - {@link #stop()} closes the listener and every connection, shuts down the
 *   event loop and blocks until its thread has terminated.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private final InetSocketAddress bindAddress;
    private final Duration shutdownTimeout;

    private final EventLoopGroup group;
    private final ChannelGroup channels;
    private final ServerBootstrap bootstrap;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile StreamEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpStreamEndpoint(InetSocketAddress bindAddress, Duration shutdownTimeout)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("adb-emulator-loop"));
        this.channels = new DefaultChannelGroup("adb-emulator", GlobalEventExecutor.INSTANCE);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(group, group)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.SO_BACKLOG, 5)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        channels.add(ch);
                        ch.pipeline().addLast(new ConnectionHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public InetSocketAddress start()
    {
        StreamEndpointListener l = requireListener();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Endpoint already started");
        }

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            stopped.set(true);
            group.shutdownGracefully(0, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .awaitUninterruptibly();
            l.onTransportDown(f.cause());
            throw new EmulatorTransportException("Failed to bind " + bindAddress, f.cause());
        }

        Channel ch = f.channel();
        channels.add(ch);
        serverChannel = ch;

        InetSocketAddress local = (InetSocketAddress) ch.localAddress();
        l.onTransportUp(local);
        return local;
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        // Listener first so no new connection slips in, then every accepted one.
        channels.close().awaitUninterruptibly();
        group.shutdownGracefully(0, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .awaitUninterruptibly();
        serverChannel = null;

        StreamEndpointListener l = listener;
        if (l != null && started.get()) {
            l.onTransportDown(null);
        }
    }

    /**
     * Returns the bound address, or {@code null} before {@link #start()} and after {@link #stop()}.
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return (ch == null) ? null : (InetSocketAddress) ch.localAddress();
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    private static String describe(Channel ch)
    {
        return ch.id().asShortText() + "/" + ch.remoteAddress();
    }

    /**
     * ChannelStreamConnection
     * -------------------------------------------------------------------------
     * Outbound side of an accepted channel. Called on the event loop only.
     */
    private static final class ChannelStreamConnection implements StreamConnection
    {
        private final Channel channel;

        ChannelStreamConnection(Channel channel)
        {
            this.channel = channel;
        }

        @Override
        public void write(byte[] bytes)
        {
            Objects.requireNonNull(bytes, "bytes");
            if (!channel.isActive()) {
                return;
            }
            channel.writeAndFlush(Unpooled.wrappedBuffer(bytes));
        }

        @Override
        public void close()
        {
            channel.close();
        }
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * Cumulates inbound bytes of one channel and hands them to the protocol
     * listener in exactly the chunk sizes it asks for.
     */
    private final class ConnectionHandler extends ByteToMessageDecoder
    {
        private String connectionId;
        private StreamConnectionListener connection;

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            connectionId = describe(ctx.channel());
            connection = requireListener().onConnectionAccepted(
                    connectionId, new ChannelStreamConnection(ctx.channel()));
            super.channelActive(ctx);
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
        {
            StreamConnectionListener c = connection;
            if (c == null) {
                return;
            }

            while (c.isOpen()) {
                int required = c.bytesRequired();
                if (required <= 0 || in.readableBytes() < required) {
                    return;
                }
                byte[] chunk = new byte[required];
                in.readBytes(chunk);
                c.onBytes(chunk);
            }

            // Closed by the protocol: anything still buffered is dropped.
            in.skipBytes(in.readableBytes());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            super.channelInactive(ctx);
            StreamConnectionListener c = connection;
            if (c != null) {
                c.onClosed();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Resets and broken pipes are an abrupt close, not an error.
            if (!(cause instanceof IOException)) {
                StreamEndpointListener l = listener;
                if (l != null) {
                    l.onConnectionError(connectionId, cause);
                }
            }
            ctx.close();
        }
    }
}
