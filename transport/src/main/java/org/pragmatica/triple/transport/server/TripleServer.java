package org.pragmatica.triple.transport.server;

import org.pragmatica.triple.config.TripleOption;
import org.pragmatica.triple.transport.server.impl.NettyTripleServer;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Triple server accepting h2c connections and dispatching each stream by path to a registered
 * {@link MethodHandler}.
 * <p>
 * Create instances using {@link #tripleServer(TripleOption, ServiceRegistry)}.
 *
 * <h2>Example Usage</h2>
 * <pre>{@code
 * var registry = ServiceRegistry.serviceRegistry()
 *                               .register("com.example.IGreeter", "SayHello",
 *                                         MethodHandler.unary(HelloRequest.class, request -> reply(request)));
 *
 * var server = TripleServer.tripleServer(tripleOption(withLocation("0.0.0.0:20001"),
 *                                                     withSerializerType("fury")), registry);
 * server.start().join();
 * }</pre>
 */
public interface TripleServer {

    /**
     * Bind the listening socket.
     *
     * @return future completed when the server is listening, or failed with a
     *         {@link org.pragmatica.triple.common.TripleException} carrying
     *         {@link org.pragmatica.triple.common.TripleError.BindFailed}
     */
    CompletableFuture<Void> start();

    /**
     * Stop accepting connections and shut the server down.
     */
    CompletableFuture<Void> stop();

    /**
     * Actual listening port, available once started.
     */
    Optional<Integer> boundPort();

    /**
     * Number of streams accepted since start.
     */
    long acceptedCalls();

    /**
     * Create a server listening on {@code option.location()} with default socket options.
     *
     * @throws org.pragmatica.triple.common.TripleException with
     *         {@link org.pragmatica.triple.common.TripleError.InvalidConfiguration} for an unusable address
     *         or serializer type
     */
    static TripleServer tripleServer(TripleOption option, ServiceRegistry registry) {
        return tripleServer(option, registry, SocketOptions.defaults());
    }

    static TripleServer tripleServer(TripleOption option, ServiceRegistry registry, SocketOptions socketOptions) {
        return NettyTripleServer.create(option, registry, socketOptions);
    }
}
