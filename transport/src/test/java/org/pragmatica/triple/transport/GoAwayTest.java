package org.pragmatica.triple.transport;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http2.DefaultHttp2DataFrame;
import io.netty.handler.codec.http2.DefaultHttp2GoAwayFrame;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.Http2Error;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pragmatica.triple.codec.PackageHandler;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.GrpcStatus;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.common.TripleHeaders;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.pragmatica.triple.config.TripleOption.tripleOption;
import static org.pragmatica.triple.config.TripleOption.withLocation;
import static org.pragmatica.triple.config.TripleOption.withTimeout;

/**
 * Graceful shutdown of the peer: GOAWAY followed by a late answer to a stream it has already accepted.
 */
@Timeout(30)
class GoAwayTest {
    private static final String PATH = "/com.example.IGreeter/SayHello";

    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private Channel serverChannel;
    private H2Controller controller;

    @BeforeEach
    void setUp() {
        serverChannel = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(Http2FrameCodecBuilder.forServer().build());
                        ch.pipeline().addLast(new Http2MultiplexHandler(new ChannelInitializer<Http2StreamChannel>() {
                            @Override
                            protected void initChannel(Http2StreamChannel stream) {
                                stream.pipeline().addLast(new DrainingResponder());
                            }
                        }));
                    }
                })
                .bind("127.0.0.1", 0)
                .syncUninterruptibly()
                .channel();

        var port = ((InetSocketAddress) serverChannel.localAddress()).getPort();

        controller = H2Controller.connect(tripleOption(withLocation("127.0.0.1:" + port),
                                                       withTimeout(Duration.ofSeconds(5))));
    }

    @AfterEach
    void tearDown() {
        controller.destroy();
        serverChannel.close().syncUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test
    void acceptedStream_completesAfterGoAway() {
        var response = controller.unaryInvoke(CallContext.background(), PATH, new byte[]{1});

        assertThat(response).containsExactly(42);
    }

    @Test
    void goAway_stopsNewStreams() {
        controller.unaryInvoke(CallContext.background(), PATH, new byte[]{1});

        await().atMost(Duration.ofSeconds(5)).until(() -> !controller.isAvailable());

        assertThatThrownBy(() -> controller.openStream(CallContext.background(), PATH))
                .isInstanceOf(TripleException.class)
                .satisfies(e -> assertThat(((TripleException) e).error()).isInstanceOf(TripleError.ConnectionUnavailable.class));
    }

    /**
     * Announces shutdown as soon as a request arrives and answers it 200 ms later.
     */
    private static final class DrainingResponder extends ChannelInboundHandlerAdapter {
        private boolean answered;

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            try {
                if (msg instanceof Http2HeadersFrame && !answered) {
                    answered = true;
                    ctx.channel().parent().writeAndFlush(new DefaultHttp2GoAwayFrame(Http2Error.NO_ERROR));
                    ctx.executor().schedule(() -> respond(ctx), 200, TimeUnit.MILLISECONDS);
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        private static void respond(ChannelHandlerContext ctx) {
            var headers = new DefaultHttp2Headers().status("200");
            headers.set(TripleHeaders.CONTENT_TYPE, TripleHeaders.GRPC_CONTENT_TYPE);

            var payload = PackageHandler.grpcPackageHandler().pkgToFrameData(new byte[]{42});
            var trailers = new DefaultHttp2Headers();
            trailers.set(TripleHeaders.GRPC_STATUS, GrpcStatus.OK.asHeader());

            ctx.write(new DefaultHttp2HeadersFrame(headers));
            ctx.write(new DefaultHttp2DataFrame(Unpooled.wrappedBuffer(payload)));
            ctx.writeAndFlush(new DefaultHttp2HeadersFrame(trailers, true));
        }
    }
}
