// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.LineEncoder;
import io.netty.handler.codec.string.LineSeparator;
import io.netty.handler.codec.string.StringDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty TCP server speaking the line protocol.
 *
 * <p>
 * Lines are UTF-8, terminated by LF or CRLF on input and CRLF on output. Each
 * connection gets its own {@link LineServerHandler}.
 *
 * @since 0.1.0
 */
public final class SoulwireServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SoulwireServer.class);

    private final String host;
    private final int port;
    private final int ioThreads;
    private final int maxLineLength;
    private final CommandDispatcher dispatcher;
    private final AtomicBoolean closed = new AtomicBoolean();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SoulwireServer(
            final String host,
            final int port,
            final int ioThreads,
            final int maxLineLength,
            final CommandDispatcher dispatcher) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.ioThreads = ioThreads;
        this.maxLineLength = maxLineLength;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Installs the line codec and a fresh handler on a connection's pipeline.
     */
    static void configure(final ChannelPipeline pipeline, final int maxLineLength, final CommandDispatcher dispatcher) {
        pipeline.addLast("framer", new LineBasedFrameDecoder(maxLineLength, true, true));
        pipeline.addLast("decoder", new StringDecoder(StandardCharsets.UTF_8));
        pipeline.addLast("encoder", new LineEncoder(LineSeparator.WINDOWS, StandardCharsets.UTF_8));
        pipeline.addLast("handler", new LineServerHandler(dispatcher));
    }

    /**
     * Binds the listening socket.
     *
     * @return the bound port, useful when configured with port 0
     * @throws InterruptedException if interrupted while binding
     */
    public int start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1, threadFactory("soulwire-accept"));
        workerGroup = new NioEventLoopGroup(ioThreads, threadFactory("soulwire-netty-io"));

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        configure(ch.pipeline(), maxLineLength, dispatcher);
                    }
                });

        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
        final int bound = boundPort();
        log.info("Soulwire listening on {}:{}", host, bound);
        return bound;
    }

    /**
     * Returns the port the server is bound to, or -1 before {@link #start()}.
     */
    public int boundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Blocks until the listening channel closes.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitClose() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing server channel", e);
            }
        }
        shutdownGroups();
        log.info("Soulwire server stopped");
    }

    private void shutdownGroups() {
        for (EventLoopGroup group : new EventLoopGroup[] {bossGroup, workerGroup}) {
            if (group == null) {
                continue;
            }
            try {
                group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while shutting down EventLoopGroup", e);
            }
        }
    }

    private static ThreadFactory threadFactory(final String name) {
        final AtomicInteger counter = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
