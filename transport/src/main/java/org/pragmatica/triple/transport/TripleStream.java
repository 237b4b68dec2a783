package org.pragmatica.triple.transport;

import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.GrpcStatus;
import org.pragmatica.triple.common.TripleError;

import java.util.Map;

/**
 * One logical, ordered, bidirectional channel of frames multiplexed over a physical connection.
 * One stream carries exactly one call.
 */
public interface TripleStream extends AutoCloseable {

    /**
     * HTTP/2 stream id, or {@code -1} while not yet assigned.
     */
    int id();

    /**
     * Call path, {@code /interfaceKey/methodName}.
     */
    String path();

    StreamRole role();

    /**
     * Write a frame. {@link Frame#close()} half-closes the sending side.
     *
     * @throws org.pragmatica.triple.common.TripleException with {@link TripleError.StreamClosed}
     *         if the sending side is closed
     */
    void send(Frame frame);

    /**
     * Block for the next inbound frame. Returns {@link Inbound.Closed} once the stream is closed and
     * {@link Inbound.Aborted} if the context deadline passes or the context is cancelled while waiting.
     */
    Inbound receive(CallContext context);

    /**
     * Server side: finish the call with the given status in the trailers.
     *
     * @throws IllegalStateException on a client stream
     */
    void finish(GrpcStatus status, String message);

    /**
     * Headers received from the remote side, empty until they arrive.
     */
    Map<String, String> headers();

    /**
     * Trailers received from the remote side, empty until they arrive.
     */
    Map<String, String> trailers();

    boolean isOpen();

    /**
     * True once the local sending side is closed, by a half-close or by finishing the call.
     */
    boolean isSendClosed();

    /**
     * Close inbound side with {@code reason}, reset the HTTP/2 stream if it is still open and release it.
     */
    void abort(TripleError reason);

    /**
     * Release the stream. Resets the HTTP/2 stream if the call has not finished.
     */
    @Override
    void close();
}
