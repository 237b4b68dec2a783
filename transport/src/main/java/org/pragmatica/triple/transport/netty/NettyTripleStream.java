package org.pragmatica.triple.transport.netty;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http2.DefaultHttp2DataFrame;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2StreamChannel;
import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.GrpcStatus;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleHeaders;
import org.pragmatica.triple.transport.Inbound;
import org.pragmatica.triple.transport.StreamRole;
import org.pragmatica.triple.transport.TripleStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link TripleStream} over a Netty HTTP/2 child channel.
 * <p>
 * Writes are handed to the channel event loop in call order. Response headers of a server stream are
 * sent lazily, with the first message or with the trailers.
 */
public final class NettyTripleStream implements TripleStream {
    private static final Logger log = LoggerFactory.getLogger(NettyTripleStream.class);

    private final Http2StreamChannel channel;
    private final StreamRole role;
    private final String path;
    private final StreamFrameHandler inbound;
    private final Consumer<TripleStream> onRelease;

    private final AtomicBoolean sendClosed = new AtomicBoolean(false);
    private final AtomicBoolean responseHeadersSent = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);

    public NettyTripleStream(Http2StreamChannel channel,
                             StreamRole role,
                             String path,
                             StreamFrameHandler inbound,
                             Consumer<TripleStream> onRelease) {
        this.channel = channel;
        this.role = role;
        this.path = path;
        this.inbound = inbound;
        this.onRelease = onRelease;

        inbound.queue().onPressure(saturated -> channel.config().setAutoRead(!saturated));
    }

    /**
     * Client side: write the request headers which open the HTTP/2 stream.
     */
    public void sendRequestHeaders(Http2Headers headers) {
        channel.writeAndFlush(new DefaultHttp2HeadersFrame(headers, false))
               .addListener(future -> {
                   if (!future.isSuccess()) {
                       log.error("Failed to open stream for {}", path, future.cause());
                       abort(new TripleError.RemoteFailure(GrpcStatus.UNAVAILABLE, String.valueOf(future.cause().getMessage())));
                   }
               });
    }

    @Override
    public int id() {
        return channel.stream().id();
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public StreamRole role() {
        return role;
    }

    @Override
    public void send(Frame frame) {
        if (frame.isData()) {
            if (sendClosed.get() || released.get()) {
                throw new TripleError.StreamClosed(id()).exception();
            }
            if (role == StreamRole.SERVER) {
                sendResponseHeaders();
            }
            channel.writeAndFlush(new DefaultHttp2DataFrame(Unpooled.wrappedBuffer(frame.payload()), false))
                   .addListener(future -> {
                       if (!future.isSuccess()) {
                           log.error("Failed to write {} on stream {}", frame, id(), future.cause());
                       }
                   });
            return;
        }

        if (role == StreamRole.SERVER) {
            finish(GrpcStatus.OK, null);
            return;
        }
        if (!sendClosed.compareAndSet(false, true)) {
            throw new TripleError.StreamClosed(id()).exception();
        }
        channel.writeAndFlush(new DefaultHttp2DataFrame(true));
    }

    @Override
    public Inbound receive(CallContext context) {
        return inbound.queue().receive(context);
    }

    @Override
    public void finish(GrpcStatus status, String message) {
        if (role != StreamRole.SERVER) {
            throw new IllegalStateException("Only a server stream can be finished with a status");
        }
        if (!sendClosed.compareAndSet(false, true)) {
            throw new TripleError.StreamClosed(id()).exception();
        }

        Http2Headers trailers = responseHeadersSent.compareAndSet(false, true)
                                ? responseHeaders()
                                : new DefaultHttp2Headers();

        trailers.set(TripleHeaders.GRPC_STATUS, status.asHeader());

        if (message != null && !message.isEmpty()) {
            trailers.set(TripleHeaders.GRPC_MESSAGE, TripleHeaders.encodeMessage(message));
        }

        channel.writeAndFlush(new DefaultHttp2HeadersFrame(trailers, true));
    }

    @Override
    public Map<String, String> headers() {
        return inbound.headers();
    }

    @Override
    public Map<String, String> trailers() {
        return inbound.trailers();
    }

    @Override
    public boolean isOpen() {
        return !released.get() && channel.isActive();
    }

    @Override
    public boolean isSendClosed() {
        return sendClosed.get();
    }

    @Override
    public void abort(TripleError reason) {
        inbound.queue().abort(reason);
        close();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }

        inbound.queue().abort(new TripleError.StreamClosed(id()));

        if (channel.isActive()) {
            // Closing an unfinished child channel resets the HTTP/2 stream
            channel.close();
        }
        onRelease.accept(this);
    }

    private void sendResponseHeaders() {
        if (responseHeadersSent.compareAndSet(false, true)) {
            channel.write(new DefaultHttp2HeadersFrame(responseHeaders(), false));
        }
    }

    private static Http2Headers responseHeaders() {
        return new DefaultHttp2Headers().status("200")
                                        .set(TripleHeaders.CONTENT_TYPE, TripleHeaders.GRPC_CONTENT_TYPE);
    }

    @Override
    public String toString() {
        return "NettyTripleStream{" + role + ", " + path + ", id=" + id() + "}";
    }
}
