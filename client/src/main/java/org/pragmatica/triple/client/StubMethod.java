package org.pragmatica.triple.client;

import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.TripleException;

/**
 * One bound method of a service stub.
 */
@FunctionalInterface
public interface StubMethod {

    InvocationResult invoke(CallContext context, Object request);

    /**
     * Unary method calling {@code path} and decoding the reply as {@code replyType}.
     */
    static StubMethod unary(TripleConnection connection, String path, Class<?> replyType) {
        return (context, request) -> {
            try {
                return InvocationResult.success(connection.unary(context, path, request, replyType));
            } catch (TripleException e) {
                return InvocationResult.failure(e.error());
            }
        };
    }
}
