package org.pragmatica.triple.transport.netty;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handler for streams opened by the remote side of a client connection. A client never accepts
 * such streams, so they are closed as soon as they appear.
 */
@ChannelHandler.Sharable
public final class RejectInboundStreams extends ChannelInboundHandlerAdapter {
    public static final RejectInboundStreams INSTANCE = new RejectInboundStreams();

    private static final Logger log = LoggerFactory.getLogger(RejectInboundStreams.class);

    private RejectInboundStreams() {}

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        log.warn("Dropping inbound stream {} on a client connection", ctx.channel());
        ctx.close();
    }
}
