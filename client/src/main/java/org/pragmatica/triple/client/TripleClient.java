package org.pragmatica.triple.client;

import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.common.TripleHeaders;
import org.pragmatica.triple.config.TripleOption;
import org.pragmatica.triple.serialization.SerializerType;
import org.pragmatica.triple.transport.H2Controller;
import org.pragmatica.triple.transport.UserStream;
import org.slf4j.Logger;

import java.util.Optional;

/**
 * Invocation client of one remote endpoint.
 * <p>
 * The serializer type of the option decides how {@link #invoke} dispatches: schema-based calls
 * ({@code protobuf}) go through the methods of the service binding, dynamic calls ({@code fury},
 * {@code kryo}) are sent to {@code /<interfaceKey>/<methodName>} with the interface key taken from
 * the call context. An unknown serializer type does not prevent creation, every invocation fails
 * with {@link TripleError.UnknownSerializer} instead.
 *
 * <h2>Example Usage</h2>
 * <pre>{@code
 * try (var client = TripleClient.tripleClient(tripleOption(withLocation("127.0.0.1:20001"),
 *                                                          withSerializerType("fury")))) {
 *     var context = CallContext.callContext("com.example.IGreeter");
 *     var result = client.invoke("SayHello", context, new HelloRequest("laurence"));
 * }
 * }</pre>
 */
public interface TripleClient extends AutoCloseable {

    /**
     * Invoke a method by name. Never throws for call failures, they are reported in the result.
     */
    InvocationResult invoke(String methodName, CallContext context, Object request);

    /**
     * Direct unary call to {@code path}, bypassing the dispatch table.
     *
     * @throws TripleException carrying the failure
     */
    <T> T request(CallContext context, String path, Object argument, Class<T> replyType);

    /**
     * Open a streaming call to {@code path}.
     *
     * @throws TripleException carrying the failure
     */
    UserStream requestStream(CallContext context, String path);

    boolean isAvailable();

    /**
     * Methods bound for schema-based dispatch.
     */
    DispatchTable dispatchTable();

    /**
     * Destroy the connection. Safe to call repeatedly.
     */
    @Override
    void close();

    /**
     * Client of a dynamic-codec service.
     */
    static TripleClient tripleClient(TripleOption option) {
        return tripleClient(ServiceBinding.none(), option);
    }

    /**
     * Connect to {@code option.location()} and bind the service stub.
     *
     * @throws TripleException with {@link TripleError.InvalidConfiguration} or {@link TripleError.ConnectFailed}
     */
    static TripleClient tripleClient(ServiceBinding binding, TripleOption option) {
        record tripleClient(H2Controller controller,
                            TripleOption option,
                            Optional<TripleConnection> connection,
                            DispatchTable dispatchTable) implements TripleClient {

            @Override
            public InvocationResult invoke(String methodName, CallContext context, Object request) {
                var log = option.logger();

                if (connection.isEmpty()) {
                    var error = new TripleError.UnknownSerializer(option.serializerType());
                    log.error(error.message());
                    return InvocationResult.failure(error);
                }

                if (SerializerType.isSchema(option.serializerType())) {
                    return dispatchTable.lookup(methodName)
                                        .map(method -> method.invoke(context, request))
                                        .orElseGet(() -> InvocationResult.failure(new TripleError.MethodNotFound(methodName)));
                }

                var interfaceKey = context.interfaceKey();

                if (interfaceKey.isEmpty()) {
                    return InvocationResult.failure(new TripleError.InvalidConfiguration("call context of " + methodName
                                                                                         + " carries no interface key"));
                }

                var path = TripleHeaders.path(interfaceKey.get(), methodName);

                try {
                    return InvocationResult.success(connection.get().unary(context, path, request, Object.class));
                } catch (TripleException e) {
                    log.error("Call {} failed: {}", path, e.error().message());
                    return InvocationResult.failure(e.error());
                }
            }

            @Override
            public <T> T request(CallContext context, String path, Object argument, Class<T> replyType) {
                return requireConnection().unary(context, path, argument, replyType);
            }

            @Override
            public UserStream requestStream(CallContext context, String path) {
                return requireConnection().stream(context, path);
            }

            @Override
            public boolean isAvailable() {
                return controller.isAvailable();
            }

            @Override
            public void close() {
                controller.destroy();
            }

            private TripleConnection requireConnection() {
                return connection.orElseThrow(() -> new TripleError.UnknownSerializer(option.serializerType()).exception());
            }
        }

        var validated = option.validate();
        var log = validated.logger();
        var serializer = SerializerType.serializer(validated.serializerType(), validated.classRegistrators());

        if (serializer.isEmpty()) {
            log.warn("Invalid triple client serializerType = {}", validated.serializerType());
        }

        var controller = H2Controller.connect(validated);
        var connection = serializer.map(value -> TripleConnection.tripleConnection(controller, value, log));

        if (connection.isEmpty() || !SerializerType.isSchema(validated.serializerType())) {
            return new tripleClient(controller, validated, connection, DispatchTable.empty());
        }

        try {
            var table = DispatchTable.dispatchTable(binding.bind(connection.get()));
            log.debug("Bound {} methods of {}", table.methodNames().size(), binding.interfaceKey());
            return new tripleClient(controller, validated, connection, table);
        } catch (RuntimeException e) {
            controller.destroy();
            throw e;
        }
    }
}
