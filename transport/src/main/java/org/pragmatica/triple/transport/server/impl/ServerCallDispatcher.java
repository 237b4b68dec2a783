package org.pragmatica.triple.transport.server.impl;

import io.netty.handler.codec.http2.Http2StreamChannel;
import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.codec.PackageHandler;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.GrpcStatus;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.common.TripleHeaders;
import org.pragmatica.triple.serialization.TripleSerializer;
import org.pragmatica.triple.transport.Inbound;
import org.pragmatica.triple.transport.StreamRole;
import org.pragmatica.triple.transport.TripleStream;
import org.pragmatica.triple.transport.UserStream;
import org.pragmatica.triple.transport.netty.NettyTripleStream;
import org.pragmatica.triple.transport.netty.StreamFrameHandler;
import org.pragmatica.triple.transport.server.MethodHandler;
import org.pragmatica.triple.transport.server.ServiceRegistry;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes inbound server streams to their method handlers. Called on the event loop when the request
 * headers arrive; handlers themselves run on the worker executor.
 */
final class ServerCallDispatcher {
    private final ServiceRegistry registry;
    private final TripleSerializer serializer;
    private final Executor workers;
    private final Duration requestTimeout;
    private final Logger log;
    private final PackageHandler packageHandler = PackageHandler.grpcPackageHandler();
    private final AtomicLong acceptedCalls = new AtomicLong();

    ServerCallDispatcher(ServiceRegistry registry,
                         TripleSerializer serializer,
                         Executor workers,
                         Duration requestTimeout,
                         Logger log) {
        this.registry = registry;
        this.serializer = serializer;
        this.workers = workers;
        this.requestTimeout = requestTimeout;
        this.log = log;
    }

    long acceptedCalls() {
        return acceptedCalls.get();
    }

    void dispatch(Http2StreamChannel channel, Map<String, String> headers) {
        acceptedCalls.incrementAndGet();

        var path = headers.getOrDefault(":path", "");
        var inbound = channel.pipeline().get(StreamFrameHandler.class);
        var stream = new NettyTripleStream(channel, StreamRole.SERVER, path, inbound, released -> {});
        var handler = registry.lookup(path);

        if (handler.isEmpty()) {
            log.warn("No handler for {}", path);
            stream.finish(GrpcStatus.UNIMPLEMENTED, "Method not found: " + path);
            return;
        }

        var context = callContext(path, headers);

        log.debug("Dispatching {} with request id {}", path, context.requestId());

        try {
            workers.execute(() -> invoke(handler.get(), stream, context));
        } catch (RejectedExecutionException e) {
            log.warn("Rejected call {}, server is shutting down", path);
            stream.finish(GrpcStatus.UNAVAILABLE, "Server is shutting down");
        }
    }

    private void invoke(MethodHandler handler, TripleStream stream, CallContext context) {
        try {
            if (handler instanceof MethodHandler.Unary<?, ?> unary) {
                invokeUnary(unary, stream, context);
            } else if (handler instanceof MethodHandler.Streaming streaming) {
                streaming.method().handle(UserStream.serverStream(stream, context, serializer, log));
            }
            finishQuietly(stream, GrpcStatus.OK, null);
        } catch (TripleException e) {
            log.error("Call {} failed: {}", stream.path(), e.error().message());
            finishQuietly(stream, GrpcStatus.forError(e.error()), e.error().message());
        } catch (Exception e) {
            log.error("Handler of {} failed", stream.path(), e);
            finishQuietly(stream, GrpcStatus.UNKNOWN, String.valueOf(e.getMessage()));
        }
    }

    private <Q, R> void invokeUnary(MethodHandler.Unary<Q, R> unary, TripleStream stream, CallContext context) {
        var inbound = stream.receive(context.withTimeout(requestTimeout));

        if (inbound instanceof Inbound.Aborted aborted) {
            throw aborted.reason().exception();
        }
        if (inbound instanceof Inbound.Closed closed) {
            if (!(closed.reason() instanceof TripleError.StreamClosed)) {
                throw closed.reason().exception();
            }
            throw new TripleError.RemoteFailure(GrpcStatus.INTERNAL,
                                                "request carries no message: " + closed.reason().message()).exception();
        }

        var payload = packageHandler.frameToPkgData(((Inbound.Message) inbound).frame().payload());
        var request = serializer.unmarshal(payload, unary.requestType());
        var response = unary.function().apply(request);

        stream.send(Frame.data(packageHandler.pkgToFrameData(serializer.marshal(response))));
    }

    private static void finishQuietly(TripleStream stream, GrpcStatus status, String message) {
        if (!stream.isSendClosed() && stream.isOpen()) {
            stream.finish(status, message);
        }
    }

    private static CallContext callContext(String path, Map<String, String> headers) {
        var context = CallContext.background()
                                 .withInterfaceKey(interfaceKey(path));
        var requestId = headers.get(TripleHeaders.TRIPLE_REQUEST_ID);

        if (requestId != null) {
            context = context.withRequestId(requestId);
        }

        var timeout = TripleHeaders.parseGrpcTimeout(headers.get(TripleHeaders.GRPC_TIMEOUT));

        if (timeout.isPresent()) {
            context = context.withTimeout(timeout.get());
        }
        return context;
    }

    private static String interfaceKey(String path) {
        var last = path.lastIndexOf('/');

        return last > 0 ? path.substring(1, last) : "";
    }
}
