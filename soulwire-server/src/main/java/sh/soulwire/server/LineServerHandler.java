// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.io.IOException;
import java.util.Objects;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.WireLogger;
import sh.soulwire.core.auth.Session;
import sh.soulwire.core.error.ReplyCode;

/**
 * Per-connection handler: one session per channel, one dispatched command per
 * decoded line.
 *
 * <p>
 * Sits behind a {@code LineBasedFrameDecoder} and a {@code StringDecoder}. An
 * over-long line is answered with {@code ERR_LINE_TOO_LONG}; the decoder skips to
 * the next terminator and the connection stays open.
 *
 * @since 0.1.0
 */
final class LineServerHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger log = LoggerFactory.getLogger(LineServerHandler.class);

    private final CommandDispatcher dispatcher;
    private Session session;
    private ChannelOutbound outbound;

    LineServerHandler(final CommandDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        outbound = new ChannelOutbound(ctx.channel());
        session = dispatcher.connected(outbound);
        outbound.sessionId = session.id();
        log.debug("Session {} connected from {}", session.id(), ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final String line) {
        WireLogger.logInbound(session.id(), line);
        dispatcher.dispatch(session, line, outbound);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            dispatcher.disconnected(session);
            log.debug("Session {} disconnected", session.id());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            log.debug("Session {} sent an over-long line: {}", sessionId(), cause.getMessage());
            if (outbound != null) {
                outbound.send(ReplyCode.ERR_LINE_TOO_LONG.format(null));
            }
            return;
        }
        if (cause instanceof IOException) {
            log.debug("Session {} I/O error: {}", sessionId(), cause.getMessage());
        } else {
            log.error("Channel exception on session {}", sessionId(), cause);
        }
        ctx.close();
    }

    private String sessionId() {
        return session == null ? "-" : session.id();
    }

    /**
     * Writes lines to a Netty channel; the pipeline's line encoder adds the terminator.
     */
    private static final class ChannelOutbound implements Outbound {
        private final Channel channel;
        private volatile String sessionId = "-";

        ChannelOutbound(final Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(final String line) {
            WireLogger.logOutbound(sessionId, line);
            channel.writeAndFlush(line);
        }

        @Override
        public void close() {
            channel.writeAndFlush(Unpooled.EMPTY_BUFFER)
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }
}
