package org.pragmatica.triple.transport.server;

import org.pragmatica.triple.transport.UserStream;

import java.util.function.Function;

/**
 * Server-side implementation of one method.
 */
public sealed interface MethodHandler {

    /**
     * Reads one request message, applies {@code function} and writes its result as the only response message.
     */
    record Unary<Q, R>(Class<Q> requestType, Function<Q, R> function) implements MethodHandler {}

    /**
     * Receives a server-side {@link UserStream} and paces messages itself. The call finishes with OK when
     * {@link StreamingMethod#handle(UserStream)} returns, unless the handler finished it already.
     */
    record Streaming(StreamingMethod method) implements MethodHandler {}

    @FunctionalInterface
    interface StreamingMethod {
        void handle(UserStream stream) throws Exception;
    }

    static <Q, R> MethodHandler unary(Class<Q> requestType, Function<Q, R> function) {
        return new Unary<>(requestType, function);
    }

    static MethodHandler streaming(StreamingMethod method) {
        return new Streaming(method);
    }
}
