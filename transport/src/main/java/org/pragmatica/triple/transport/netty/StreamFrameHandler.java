package org.pragmatica.triple.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2ResetFrame;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.handler.codec.http2.Http2StreamFrame;
import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.codec.PackageHandler;
import org.pragmatica.triple.common.GrpcStatus;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.common.TripleHeaders;
import org.pragmatica.triple.transport.ReceiveQueue;
import org.pragmatica.triple.transport.StreamRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound side of one HTTP/2 stream.
 * <p>
 * Re-joins DATA frames into whole messages and appends them to the stream receive queue, records
 * headers and trailers, and translates end-of-stream, reset and channel loss into queue closure.
 * <p>
 * A message announcing more than {@code maxMessageSize} payload bytes closes the queue with
 * {@code RESOURCE_EXHAUSTED}. The rest of the inbound data is dropped. A client stream is reset at once,
 * a server stream stays open so the call can still be answered with that status.
 */
public final class StreamFrameHandler extends SimpleChannelInboundHandler<Http2StreamFrame> {
    private static final Logger log = LoggerFactory.getLogger(StreamFrameHandler.class);

    public static final int DEFAULT_MAX_MESSAGE_SIZE = 4 * 1024 * 1024;

    /**
     * Called on the event loop when the first headers frame of the stream arrives.
     */
    @FunctionalInterface
    public interface HeadersListener {
        HeadersListener NONE = (channel, headers) -> {};

        void onHeaders(Http2StreamChannel channel, Map<String, String> headers);
    }

    private final ReceiveQueue queue;
    private final PackageHandler packageHandler;
    private final StreamRole role;
    private final HeadersListener headersListener;
    private final int maxMessageSize;

    private ByteBuf cumulation;
    private boolean discarding;
    private volatile Map<String, String> headers = Map.of();
    private volatile Map<String, String> trailers = Map.of();

    public StreamFrameHandler(ReceiveQueue queue,
                              PackageHandler packageHandler,
                              StreamRole role,
                              HeadersListener headersListener) {
        this(queue, packageHandler, role, headersListener, DEFAULT_MAX_MESSAGE_SIZE);
    }

    public StreamFrameHandler(ReceiveQueue queue,
                              PackageHandler packageHandler,
                              StreamRole role,
                              HeadersListener headersListener,
                              int maxMessageSize) {
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be positive, got " + maxMessageSize);
        }
        this.queue = queue;
        this.packageHandler = packageHandler;
        this.role = role;
        this.headersListener = headersListener;
        this.maxMessageSize = maxMessageSize;
    }

    public ReceiveQueue queue() {
        return queue;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Map<String, String> trailers() {
        return trailers;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        cumulation = ctx.alloc().buffer();
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        releaseCumulation();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Http2StreamFrame frame) {
        if (frame instanceof Http2HeadersFrame headersFrame) {
            onHeaders(ctx, headersFrame);
        } else if (frame instanceof Http2DataFrame dataFrame) {
            onData(ctx, dataFrame);
        } else if (frame instanceof Http2ResetFrame resetFrame) {
            log.debug("Stream {} reset by peer with error code {}", streamId(ctx), resetFrame.errorCode());
            queue.abort(new TripleError.RemoteFailure(GrpcStatus.CANCELLED,
                                                      "stream reset with error code " + resetFrame.errorCode()));
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        queue.abort(new TripleError.StreamClosed(streamId(ctx)));
        releaseCumulation();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Error on stream {}", streamId(ctx), cause);
        queue.abort(failureOf(cause));
        ctx.close();
    }

    private void onHeaders(ChannelHandlerContext ctx, Http2HeadersFrame frame) {
        var received = toMap(frame.headers());
        var first = headers.isEmpty();

        if (role == StreamRole.CLIENT && frame.isEndStream()) {
            // Trailers, or a trailers-only response when they come first
            if (first) {
                headers = received;
            }
            trailers = received;
            onTrailers(ctx, received);
            return;
        }

        if (first) {
            headers = received;
            headersListener.onHeaders((Http2StreamChannel) ctx.channel(), received);
        }
        if (frame.isEndStream()) {
            endOfStream(ctx);
        }
    }

    private void onTrailers(ChannelHandlerContext ctx, Map<String, String> received) {
        if (cumulation.isReadable()) {
            queue.abort(truncated(cumulation.readableBytes()));
            return;
        }

        var statusValue = received.get(TripleHeaders.GRPC_STATUS);

        if (statusValue == null) {
            queue.complete(new TripleError.RemoteFailure(GrpcStatus.INTERNAL, "response trailers carry no grpc-status"));
            return;
        }

        var status = GrpcStatus.fromHeader(statusValue);

        if (status == GrpcStatus.OK) {
            queue.complete(new TripleError.StreamClosed(streamId(ctx)));
        } else {
            var description = TripleHeaders.decodeMessage(received.getOrDefault(TripleHeaders.GRPC_MESSAGE, ""));
            queue.complete(new TripleError.RemoteFailure(status, description));
        }
    }

    private void onData(ChannelHandlerContext ctx, Http2DataFrame frame) {
        if (discarding) {
            return;
        }

        cumulation.writeBytes(frame.content());

        try {
            while (true) {
                var declared = packageHandler.declaredPayloadLength(cumulation);

                if (declared > maxMessageSize) {
                    rejectOversized(ctx, declared);
                    return;
                }

                var length = packageHandler.completeFrameLength(cumulation);

                if (length < 0) {
                    break;
                }

                var message = new byte[length];
                cumulation.readBytes(message);
                queue.offer(Frame.data(message));
            }
        } catch (TripleException e) {
            log.error("Malformed inbound data on stream {}: {}", streamId(ctx), e.error().message());
            queue.abort(e.error());
            ctx.close();
            return;
        }

        cumulation.discardSomeReadBytes();

        if (frame.isEndStream()) {
            endOfStream(ctx);
        }
    }

    private void rejectOversized(ChannelHandlerContext ctx, int declared) {
        log.warn("Inbound message of {} bytes on stream {} exceeds limit of {} bytes", declared, streamId(ctx), maxMessageSize);

        discarding = true;
        cumulation.clear();
        queue.abort(new TripleError.RemoteFailure(GrpcStatus.RESOURCE_EXHAUSTED,
                                                  "message of " + declared + " bytes exceeds limit of "
                                                  + maxMessageSize + " bytes"));

        if (role == StreamRole.CLIENT) {
            ctx.close();
        }
    }

    private void endOfStream(ChannelHandlerContext ctx) {
        if (cumulation.isReadable()) {
            queue.abort(truncated(cumulation.readableBytes()));
            return;
        }
        if (role == StreamRole.SERVER) {
            queue.complete(new TripleError.StreamClosed(streamId(ctx)));
        } else {
            queue.complete(new TripleError.RemoteFailure(GrpcStatus.INTERNAL, "response ended without trailers"));
        }
    }

    private void releaseCumulation() {
        if (cumulation != null) {
            cumulation.release();
            cumulation = null;
        }
    }

    private static TripleError truncated(int remaining) {
        return new TripleError.CodecFailed("unframe",
                                           remaining + " trailing bytes",
                                           new IllegalStateException("stream ended inside a message"));
    }

    private static TripleError failureOf(Throwable cause) {
        if (cause instanceof TripleException tripleException) {
            return tripleException.error();
        }
        return new TripleError.RemoteFailure(GrpcStatus.INTERNAL, String.valueOf(cause.getMessage()));
    }

    private static int streamId(ChannelHandlerContext ctx) {
        return ctx.channel() instanceof Http2StreamChannel streamChannel ? streamChannel.stream().id() : -1;
    }

    private static Map<String, String> toMap(Http2Headers http2Headers) {
        var result = new LinkedHashMap<String, String>();

        for (var entry : http2Headers) {
            result.put(entry.getKey().toString(), entry.getValue().toString());
        }
        return Collections.unmodifiableMap(result);
    }
}
