package org.pragmatica.triple.transport.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http2.Http2GoAwayFrame;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last handler of the parent channel pipeline. Reports GOAWAY from the peer and loss of the
 * physical connection.
 */
public final class ConnectionWatcher extends ChannelInboundHandlerAdapter {
    private static final Logger log = LoggerFactory.getLogger(ConnectionWatcher.class);

    /**
     * Receiver of connection events. Both methods run on the event loop.
     */
    public interface Listener {
        /**
         * The peer accepts no new streams. Streams up to and including {@code lastStreamId} may still complete.
         */
        void goAwayReceived(int lastStreamId);

        void connectionInactive();
    }

    private final String address;
    private final Listener listener;

    public ConnectionWatcher(String address, Listener listener) {
        this.address = address;
        this.listener = listener;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (msg instanceof Http2GoAwayFrame goAway) {
                log.info("Peer {} sent GOAWAY with error code {}, last stream {}",
                         address, goAway.errorCode(), goAway.lastStreamId());
                listener.goAwayReceived(goAway.lastStreamId());
            }
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Connection to {} is inactive", address);
        listener.connectionInactive();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Connection to {} failed", address, cause);
        ctx.close();
    }
}
