package org.pragmatica.triple.client;

import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.serialization.TripleSerializer;
import org.pragmatica.triple.transport.H2Controller;
import org.pragmatica.triple.transport.UserStream;
import org.slf4j.Logger;

/**
 * Call surface of a client connection as seen by service stubs.
 */
public interface TripleConnection {

    /**
     * Marshal {@code request}, make a unary call to {@code path} and unmarshal the reply.
     *
     * @throws TripleException carrying the failure
     */
    <T> T unary(CallContext context, String path, Object request, Class<T> replyType);

    /**
     * Open a client-side streaming call to {@code path}.
     *
     * @throws TripleException if the connection is not available
     */
    UserStream stream(CallContext context, String path);

    static TripleConnection tripleConnection(H2Controller controller, TripleSerializer serializer, Logger log) {
        record tripleConnection(H2Controller controller, TripleSerializer serializer, Logger log) implements TripleConnection {
            @Override
            public <T> T unary(CallContext context, String path, Object request, Class<T> replyType) {
                var reply = controller.unaryInvoke(context, path, serializer.marshal(request));

                return serializer.unmarshal(reply, replyType);
            }

            @Override
            public UserStream stream(CallContext context, String path) {
                return UserStream.clientStream(controller.streamInvoke(context, path), context, serializer, log);
            }
        }

        return new tripleConnection(controller, serializer, log);
    }
}
