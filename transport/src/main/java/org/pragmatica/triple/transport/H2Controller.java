package org.pragmatica.triple.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.handler.codec.http2.Http2StreamChannelBootstrap;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.codec.PackageHandler;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.common.TripleHeaders;
import org.pragmatica.triple.config.Address;
import org.pragmatica.triple.config.TripleOption;
import org.pragmatica.triple.transport.netty.ConnectionWatcher;
import org.pragmatica.triple.transport.netty.NettyTripleStream;
import org.pragmatica.triple.transport.netty.RejectInboundStreams;
import org.pragmatica.triple.transport.netty.StreamFrameHandler;
import org.slf4j.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of one physical HTTP/2 (h2c, prior knowledge) connection and of the logical streams
 * multiplexed over it.
 * <p>
 * The connection is served by a dedicated single-thread event loop. Calls block the calling thread,
 * never the event loop, so none of the blocking methods may be invoked from a Netty handler.
 * <p>
 * After GOAWAY from the peer no new streams are opened, while streams the peer has accepted finish
 * normally; the remaining ones fail once the connection closes.
 * <p>
 * Teardown is a one-way state machine {@code OPEN -> CLOSING -> CLOSED}; {@link #destroy()} may be
 * called any number of times from any thread and only the first call does the work.
 */
public final class H2Controller {
    private enum State {
        OPEN,
        CLOSING,
        CLOSED
    }

    private final TripleOption option;
    private final Address address;
    private final Logger log;
    private final PackageHandler packageHandler;
    private final EventLoopGroup group;
    private final Channel channel;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private final Set<TripleStream> streams = ConcurrentHashMap.newKeySet();

    private volatile boolean connectionLost;
    private volatile boolean draining;

    private H2Controller(TripleOption option, Address address, EventLoopGroup group, Channel channel) {
        this.option = option;
        this.address = address;
        this.log = option.logger();
        this.packageHandler = PackageHandler.grpcPackageHandler();
        this.group = group;
        this.channel = channel;
    }

    /**
     * Dial {@code option.location()} and wait at most {@code option.timeout()} for the connection.
     *
     * @throws TripleException with {@link TripleError.InvalidConfiguration} for an unusable address or
     *                         {@link TripleError.ConnectFailed} when the connection cannot be established
     */
    public static H2Controller connect(TripleOption option) {
        var validated = option.validate();
        var address = Address.parse(validated.location());
        var log = validated.logger();
        var group = new NioEventLoopGroup(1, new DefaultThreadFactory("triple-client", true));
        var holder = new AtomicReference<H2Controller>();

        var bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(validated.timeout().toMillis(), Integer.MAX_VALUE))
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(validated.bufferSize()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(Http2FrameCodecBuilder.forClient().build());
                        ch.pipeline().addLast(new Http2MultiplexHandler(RejectInboundStreams.INSTANCE));
                        ch.pipeline().addLast(new ConnectionWatcher(address.asString(), new ConnectionWatcher.Listener() {
                            @Override
                            public void goAwayReceived(int lastStreamId) {
                                var controller = holder.get();

                                if (controller != null) {
                                    controller.goAwayReceived(lastStreamId);
                                }
                            }

                            @Override
                            public void connectionInactive() {
                                var controller = holder.get();

                                if (controller != null) {
                                    controller.connectionLost();
                                }
                            }
                        }));
                    }
                });

        log.info("Connecting to {}", address.asString());

        var future = bootstrap.connect(address.host(), address.port()).awaitUninterruptibly();

        if (!future.isSuccess()) {
            log.error("Failed to connect to {}", address.asString(), future.cause());
            group.shutdownGracefully();
            throw new TripleError.ConnectFailed(address.asString(), future.cause()).exception();
        }

        var controller = new H2Controller(validated, address, group, future.channel());
        holder.set(controller);

        if (!future.channel().isActive()) {
            controller.connectionLost();
        }

        log.info("Connected to {}", address.asString());
        return controller;
    }

    public String address() {
        return address.asString();
    }

    public TripleOption option() {
        return option;
    }

    /**
     * True while the controller is not destroyed, the connection is alive and the peer has not sent GOAWAY.
     */
    public boolean isAvailable() {
        return state.get() == State.OPEN && !draining && !connectionLost && channel.isActive();
    }

    /**
     * Number of streams currently open on this connection.
     */
    public int openStreams() {
        return streams.size();
    }

    /**
     * Open a new logical stream and send its request headers.
     *
     * @throws TripleException with {@link TripleError.ConnectionUnavailable} after destroy or connection loss
     */
    public TripleStream openStream(CallContext context, String path) {
        ensureAvailable();

        var queue = ReceiveQueue.receiveQueue();
        var inbound = new StreamFrameHandler(queue, packageHandler, StreamRole.CLIENT, StreamFrameHandler.HeadersListener.NONE);
        var opened = new Http2StreamChannelBootstrap(channel).handler(inbound)
                                                              .open()
                                                              .awaitUninterruptibly();

        if (!opened.isSuccess()) {
            log.error("Failed to open stream for {} on {}", path, address.asString(), opened.cause());
            throw unavailable().exception();
        }

        Http2StreamChannel streamChannel = opened.getNow();
        var stream = new NettyTripleStream(streamChannel, StreamRole.CLIENT, path, inbound, streams::remove);

        streams.add(stream);

        // Destroy may have run between the availability check and registration
        if (!isAvailable()) {
            stream.abort(unavailable());
            throw unavailable().exception();
        }

        stream.sendRequestHeaders(requestHeaders(context, path));
        log.debug("Opened stream for {} on {}, request id {}", path, address.asString(), context.requestId());
        return stream;
    }

    /**
     * Hand over a freshly opened stream; the caller paces frames and closes it.
     */
    public TripleStream streamInvoke(CallContext context, String path) {
        return openStream(context, path);
    }

    /**
     * Send one message, half-close and wait for exactly one response message.
     *
     * @param context call context; its deadline is capped by the configured timeout
     * @param path    call path
     * @param request serialized request payload
     *
     * @return serialized response payload
     *
     * @throws TripleException carrying the failure
     */
    public byte[] unaryInvoke(CallContext context, String path, byte[] request) {
        var effective = context.withTimeout(option.timeout());

        try (var stream = openStream(effective, path)) {
            stream.send(Frame.data(packageHandler.pkgToFrameData(request)));
            stream.send(Frame.close());

            var inbound = stream.receive(effective);

            if (inbound instanceof Inbound.Message message) {
                return packageHandler.frameToPkgData(message.frame().payload());
            }
            if (inbound instanceof Inbound.Closed closed) {
                throw closed.reason().exception();
            }

            var aborted = (Inbound.Aborted) inbound;
            log.debug("Call {} aborted: {}", path, aborted.reason().message());
            throw aborted.reason().exception();
        }
    }

    /**
     * Tear the connection down. Open streams are aborted, the channel is closed and the event loop
     * is shut down.
     *
     * @return true if this invocation performed the teardown
     */
    public boolean destroy() {
        if (!state.compareAndSet(State.OPEN, State.CLOSING)) {
            return false;
        }

        log.info("Closing connection to {}", address.asString());

        for (var stream : streams) {
            stream.abort(new TripleError.StreamClosed(stream.id()));
        }
        streams.clear();

        channel.close().awaitUninterruptibly();
        group.shutdownGracefully(0, option.timeout().toMillis(), TimeUnit.MILLISECONDS);
        state.set(State.CLOSED);

        log.info("Connection to {} closed", address.asString());
        return true;
    }

    /**
     * The peer stops accepting streams. Streams it will not process are aborted, the rest run to completion.
     */
    private void goAwayReceived(int lastStreamId) {
        draining = true;

        var reason = unavailable();

        for (var stream : streams) {
            if (stream.id() > lastStreamId) {
                stream.abort(reason);
            }
        }
    }

    private void connectionLost() {
        if (connectionLost) {
            return;
        }
        connectionLost = true;

        var reason = unavailable();

        for (var stream : streams) {
            stream.abort(reason);
        }
    }

    private void ensureAvailable() {
        if (!isAvailable()) {
            throw unavailable().exception();
        }
    }

    private TripleError unavailable() {
        return new TripleError.ConnectionUnavailable(address.asString());
    }

    private Http2Headers requestHeaders(CallContext context, String path) {
        var headers = new DefaultHttp2Headers().method("POST")
                                               .scheme("http")
                                               .path(path)
                                               .authority(address.asString());

        headers.set(TripleHeaders.CONTENT_TYPE, TripleHeaders.GRPC_CONTENT_TYPE)
               .set(TripleHeaders.TE, TripleHeaders.TRAILERS)
               .set(TripleHeaders.USER_AGENT, TripleHeaders.TRIPLE_USER_AGENT)
               .set(TripleHeaders.TRIPLE_REQUEST_ID, context.requestId());

        if (context.hasDeadline()) {
            headers.set(TripleHeaders.GRPC_TIMEOUT, TripleHeaders.grpcTimeout(Math.max(context.remaining().toMillis(), 1L)));
        }
        if (option.headerGroup() != null && !option.headerGroup().isEmpty()) {
            headers.set(TripleHeaders.TRIPLE_SERVICE_GROUP, option.headerGroup());
        }
        if (option.headerAppVersion() != null && !option.headerAppVersion().isEmpty()) {
            headers.set(TripleHeaders.TRIPLE_SERVICE_VERSION, option.headerAppVersion());
        }
        return headers;
    }
}
