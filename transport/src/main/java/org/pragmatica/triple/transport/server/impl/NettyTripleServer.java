package org.pragmatica.triple.transport.server.impl;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.pragmatica.triple.codec.PackageHandler;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.config.Address;
import org.pragmatica.triple.config.TripleOption;
import org.pragmatica.triple.serialization.SerializerType;
import org.pragmatica.triple.transport.ReceiveQueue;
import org.pragmatica.triple.transport.StreamRole;
import org.pragmatica.triple.transport.netty.StreamFrameHandler;
import org.pragmatica.triple.transport.server.ServiceRegistry;
import org.pragmatica.triple.transport.server.SocketOptions;
import org.pragmatica.triple.transport.server.TripleServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Netty-based Triple server over h2c with prior knowledge.
 */
public final class NettyTripleServer implements TripleServer {
    private static final Logger log = LoggerFactory.getLogger(NettyTripleServer.class);

    private final Address address;
    private final SocketOptions socketOptions;
    private final ServerCallDispatcher dispatcher;
    private final ExecutorService workers;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    private NettyTripleServer(Address address,
                              SocketOptions socketOptions,
                              ServerCallDispatcher dispatcher,
                              ExecutorService workers) {
        this.address = address;
        this.socketOptions = socketOptions;
        this.dispatcher = dispatcher;
        this.workers = workers;
    }

    public static TripleServer create(TripleOption option, ServiceRegistry registry, SocketOptions socketOptions) {
        var validated = option.validate();
        var address = Address.parse(validated.location());
        var serializer = SerializerType.serializer(validated.serializerType(), validated.classRegistrators())
                                       .orElseThrow(() -> new TripleError.InvalidConfiguration(
                                               "unknown serializer type " + validated.serializerType()).exception());
        var workers = Executors.newCachedThreadPool(new DefaultThreadFactory("triple-server-worker", true));
        var dispatcher = new ServerCallDispatcher(registry, serializer, workers, validated.timeout(), validated.logger());

        return new NettyTripleServer(address, socketOptions, dispatcher, workers);
    }

    @Override
    public CompletableFuture<Void> start() {
        var promise = new CompletableFuture<Void>();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            var bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(Http2FrameCodecBuilder.forServer().build());
                            ch.pipeline().addLast(new Http2MultiplexHandler(new ChannelInitializer<Http2StreamChannel>() {
                                @Override
                                protected void initChannel(Http2StreamChannel streamChannel) {
                                    streamChannel.pipeline().addLast(new StreamFrameHandler(ReceiveQueue.receiveQueue(),
                                                                                            PackageHandler.grpcPackageHandler(),
                                                                                            StreamRole.SERVER,
                                                                                            dispatcher::dispatch));
                                }
                            }));
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, socketOptions.soBacklog())
                    .childOption(ChannelOption.SO_KEEPALIVE, socketOptions.soKeepalive())
                    .childOption(ChannelOption.TCP_NODELAY, socketOptions.tcpNoDelay());

            var channelFuture = bootstrap.bind(address.host(), address.port());

            channelFuture.addListener(future -> {
                if (future.isSuccess()) {
                    serverChannel = channelFuture.channel();
                    log.info("Triple server started on {}:{}", address.host(), boundPort().orElse(address.port()));
                    promise.complete(null);
                } else {
                    cleanup();
                    promise.completeExceptionally(new TripleError.BindFailed(address.asString(), future.cause()).exception());
                }
            });
        } catch (Exception e) {
            cleanup();
            promise.completeExceptionally(new TripleError.BindFailed(address.asString(), e).exception());
        }
        return promise;
    }

    @Override
    public CompletableFuture<Void> stop() {
        var promise = new CompletableFuture<Void>();

        log.info("Stopping Triple server on {}", address.asString());

        if (serverChannel != null) {
            serverChannel.close().addListener(future -> {
                cleanup();
                promise.complete(null);
            });
        } else {
            cleanup();
            promise.complete(null);
        }
        return promise;
    }

    @Override
    public Optional<Integer> boundPort() {
        var channel = serverChannel;

        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress socketAddress)) {
            return Optional.empty();
        }
        return Optional.of(socketAddress.getPort());
    }

    @Override
    public long acceptedCalls() {
        return dispatcher.acceptedCalls();
    }

    private void cleanup() {
        workers.shutdown();

        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
    }
}
