package org.pragmatica.triple.transport;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.StringValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.codec.PackageHandler;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.GrpcStatus;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.config.TripleOption;
import org.pragmatica.triple.transport.netty.StreamFrameHandler;
import org.pragmatica.triple.transport.server.TripleServer;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.pragmatica.triple.config.TripleOption.tripleOption;
import static org.pragmatica.triple.config.TripleOption.withLocation;
import static org.pragmatica.triple.config.TripleOption.withTimeout;

@Timeout(30)
class H2ControllerTest {
    private static final PackageHandler PACKAGE_HANDLER = PackageHandler.grpcPackageHandler();

    private GreeterService service;
    private TripleServer server;
    private H2Controller controller;

    @BeforeEach
    void setUp() {
        service = new GreeterService();
        server = TripleServer.tripleServer(tripleOption(withLocation("127.0.0.1:0")), service.registry());
        server.start().join();

        controller = H2Controller.connect(tripleOption(withLocation("127.0.0.1:" + server.boundPort().orElseThrow()),
                                                       withTimeout(Duration.ofSeconds(5))));
    }

    @AfterEach
    void tearDown() {
        service.release();
        controller.destroy();
        server.stop().join();
    }

    private static TripleError errorOf(Throwable throwable) {
        return ((TripleException) throwable).error();
    }

    @Nested
    class Unary {
        @Test
        void unaryInvoke_returnsResponsePayload() throws InvalidProtocolBufferException {
            var response = controller.unaryInvoke(CallContext.background(),
                                                  GreeterService.SAY_HELLO,
                                                  StringValue.of("laurence").toByteArray());

            assertThat(StringValue.parseFrom(response).getValue()).isEqualTo("Hello laurence");
            assertThat(controller.openStreams()).isZero();
        }

        @Test
        void unaryInvoke_onUnknownPathFailsWithUnimplemented() {
            assertThatThrownBy(() -> controller.unaryInvoke(CallContext.background(),
                                                            "/com.example.IGreeter/Missing",
                                                            new byte[0]))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> {
                        assertThat(errorOf(e)).isInstanceOf(TripleError.RemoteFailure.class);
                        assertThat(((TripleError.RemoteFailure) errorOf(e)).status()).isEqualTo(GrpcStatus.UNIMPLEMENTED);
                    });
        }

        @Test
        void unaryInvoke_surfacesHandlerFailure() {
            assertThatThrownBy(() -> controller.unaryInvoke(CallContext.background(),
                                                            GreeterService.FAIL,
                                                            StringValue.of("bob").toByteArray()))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> {
                        var failure = (TripleError.RemoteFailure) errorOf(e);

                        assertThat(failure.status()).isEqualTo(GrpcStatus.UNKNOWN);
                        assertThat(failure.description()).isEqualTo("greeting refused for bob");
                    });
        }

        @Test
        void unaryInvoke_rejectsRequestAboveMessageSizeLimit() {
            var request = new byte[StreamFrameHandler.DEFAULT_MAX_MESSAGE_SIZE + 1];

            assertThatThrownBy(() -> controller.unaryInvoke(CallContext.background(), GreeterService.SAY_HELLO, request))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(errorOf(e))
                            .isInstanceOfSatisfying(TripleError.RemoteFailure.class,
                                                    failure -> assertThat(failure.status()).isEqualTo(GrpcStatus.RESOURCE_EXHAUSTED)));
            assertThat(controller.isAvailable()).isTrue();
        }

        @Test
        void unaryInvoke_honoursContextDeadline() {
            var context = CallContext.background().withTimeout(Duration.ofMillis(100));

            assertThatThrownBy(() -> controller.unaryInvoke(context, GreeterService.SLOW, StringValue.of("x").toByteArray()))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(TripleError.DeadlineExceeded.class));
            assertThat(controller.openStreams()).isZero();
        }

        @Test
        void requestId_isPropagated() {
            var context = CallContext.background().withRequestId("req-42");

            try (var stream = controller.streamInvoke(context, GreeterService.REQUEST_ID)) {
                stream.send(Frame.data(PACKAGE_HANDLER.pkgToFrameData(StringValue.of("who").toByteArray())));
                stream.send(Frame.close());

                var inbound = stream.receive(context.withTimeout(Duration.ofSeconds(5)));

                assertThat(inbound).isInstanceOf(Inbound.Message.class);
                var payload = PACKAGE_HANDLER.frameToPkgData(((Inbound.Message) inbound).frame().payload());
                assertThat(payload).isEqualTo(StringValue.of("req-42").toByteArray());
            }
        }
    }

    @Nested
    class Streaming {
        @Test
        void frames_arriveInSendOrder() {
            var context = CallContext.background().withTimeout(Duration.ofSeconds(10));
            var received = new ArrayList<String>();

            try (var stream = controller.streamInvoke(context, GreeterService.ECHO)) {
                for (int i = 1; i <= 50; i++) {
                    stream.send(Frame.data(PACKAGE_HANDLER.pkgToFrameData(StringValue.of("f" + i).toByteArray())));
                }
                stream.send(Frame.close());

                Inbound inbound;
                while ((inbound = stream.receive(context)) instanceof Inbound.Message message) {
                    received.add(parse(message.frame()));
                }

                assertThat(inbound).isInstanceOf(Inbound.Closed.class);
                assertThat(((Inbound.Closed) inbound).reason()).isInstanceOf(TripleError.StreamClosed.class);
                assertThat(stream.trailers()).containsEntry("grpc-status", "0");
                assertThat(stream.receive(context)).isEqualTo(inbound);
            }

            assertThat(received).hasSize(50);
            for (int i = 0; i < 50; i++) {
                assertThat(received.get(i)).isEqualTo("f" + (i + 1));
            }
        }

        @Test
        void sendAfterHalfClose_failsWithStreamClosed() {
            try (var stream = controller.streamInvoke(CallContext.background(), GreeterService.ECHO)) {
                stream.send(Frame.close());

                assertThatThrownBy(() -> stream.send(Frame.data(new byte[]{0, 0, 0, 0, 0})))
                        .isInstanceOf(TripleException.class)
                        .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(TripleError.StreamClosed.class));
            }
        }

        @Test
        void closedStream_isRemovedFromController() {
            var stream = controller.streamInvoke(CallContext.background(), GreeterService.ECHO);

            assertThat(controller.openStreams()).isEqualTo(1);

            stream.close();
            stream.close();

            assertThat(controller.openStreams()).isZero();
            assertThat(stream.isOpen()).isFalse();
        }

        private String parse(Frame frame) {
            try {
                return StringValue.parseFrom(PACKAGE_HANDLER.frameToPkgData(frame.payload())).getValue();
            } catch (InvalidProtocolBufferException e) {
                throw new AssertionError(e);
            }
        }
    }

    @Nested
    class Lifecycle {
        @Test
        void concurrentDestroy_isPerformedExactlyOnce() throws Exception {
            var threads = 16;
            var start = new CountDownLatch(1);
            var executor = Executors.newFixedThreadPool(threads);
            var results = new ArrayList<Future<Boolean>>();

            try {
                for (int i = 0; i < threads; i++) {
                    results.add(executor.submit(() -> {
                        start.await();
                        return controller.destroy();
                    }));
                }
                start.countDown();

                var performed = 0;
                for (var result : results) {
                    performed += result.get() ? 1 : 0;
                }

                assertThat(performed).isEqualTo(1);
                assertThat(controller.isAvailable()).isFalse();
                assertThat(controller.destroy()).isFalse();
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void destroyedController_rejectsNewStreams() {
            assertThat(controller.isAvailable()).isTrue();

            controller.destroy();

            assertThatThrownBy(() -> controller.openStream(CallContext.background(), GreeterService.SAY_HELLO))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(TripleError.ConnectionUnavailable.class));
            assertThatThrownBy(() -> controller.unaryInvoke(CallContext.background(), GreeterService.SAY_HELLO, new byte[0]))
                    .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(TripleError.ConnectionUnavailable.class));
        }

        @Test
        void destroy_unblocksWaitingReceiver() throws Exception {
            var stream = controller.streamInvoke(CallContext.background(), GreeterService.HOLD);
            var waiting = new FutureTask<>(() -> stream.receive(CallContext.background()));
            var receiver = new Thread(waiting);
            receiver.start();

            await().atMost(Duration.ofSeconds(5)).until(() -> ReceiveQueueTest.isParked(receiver));
            controller.destroy();

            var inbound = waiting.get();

            assertThat(inbound).isInstanceOf(Inbound.Closed.class);
            assertThat(((Inbound.Closed) inbound).reason()).isInstanceOf(TripleError.StreamClosed.class);
            assertThat(controller.openStreams()).isZero();
        }

        @Test
        void connect_toClosedPortFails() throws Exception {
            int port;
            try (var socket = new ServerSocket(0)) {
                port = socket.getLocalPort();
            }

            var option = tripleOption(withLocation("127.0.0.1:" + port), withTimeout(Duration.ofSeconds(2)));

            assertThatThrownBy(() -> H2Controller.connect(option))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(TripleError.ConnectFailed.class));
        }

        @Test
        void connect_rejectsMalformedLocation() {
            assertThatThrownBy(() -> H2Controller.connect(tripleOption(withLocation("no-port-here"))))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(TripleError.InvalidConfiguration.class));
        }

        @Test
        void option_isValidatedOnConnect() {
            assertThat(controller.option().bufferSize()).isEqualTo(TripleOption.DEFAULT_BUFFER_SIZE);
            assertThat(controller.address()).isEqualTo("127.0.0.1:" + server.boundPort().orElseThrow());
        }
    }
}
