package org.pragmatica.triple.transport;

import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.codec.PackageHandler;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.serialization.TripleSerializer;
import org.slf4j.Logger;

import java.util.Map;

/**
 * Message-level view of a {@link TripleStream} handed to application code for streaming calls.
 * <p>
 * Objects are marshalled with the call serializer and framed with the gRPC package handler.
 * Metadata operations are accepted but do nothing: setters ignore their arguments and getters return
 * empty maps. Invoking an operation which belongs to the other side of the call throws
 * {@link IllegalStateException}.
 */
public final class UserStream implements AutoCloseable {
    private final TripleStream stream;
    private final CallContext context;
    private final StreamRole role;
    private final TripleSerializer serializer;
    private final PackageHandler packageHandler;
    private final Logger log;

    private UserStream(TripleStream stream,
                       CallContext context,
                       StreamRole role,
                       TripleSerializer serializer,
                       PackageHandler packageHandler,
                       Logger log) {
        this.stream = stream;
        this.context = context;
        this.role = role;
        this.serializer = serializer;
        this.packageHandler = packageHandler;
        this.log = log;
    }

    public static UserStream clientStream(TripleStream stream, CallContext context, TripleSerializer serializer, Logger log) {
        return new UserStream(stream, context, StreamRole.CLIENT, serializer, PackageHandler.grpcPackageHandler(), log);
    }

    public static UserStream serverStream(TripleStream stream, CallContext context, TripleSerializer serializer, Logger log) {
        return new UserStream(stream, context, StreamRole.SERVER, serializer, PackageHandler.grpcPackageHandler(), log);
    }

    public CallContext context() {
        return context;
    }

    public StreamRole role() {
        return role;
    }

    public TripleStream stream() {
        return stream;
    }

    /**
     * Marshal, frame and send one message.
     *
     * @throws TripleException with {@link TripleError.CodecFailed} if the message cannot be marshalled
     *                         (the stream stays open) or {@link TripleError.StreamClosed} if the sending
     *                         side is closed
     */
    public void sendMessage(Object message) {
        byte[] payload;

        try {
            payload = serializer.marshal(message);
        } catch (TripleException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to marshal message {} on stream {}", message, stream.path(), e);
            throw new TripleError.CodecFailed("marshal", message, e).exception();
        }

        stream.send(Frame.data(packageHandler.pkgToFrameData(payload)));
    }

    /**
     * Wait for the next message and unmarshal it.
     *
     * @throws TripleException with {@link TripleError.StreamClosed} or the remote failure once the stream
     *                         is closed, with the abort reason on deadline, cancellation or interruption,
     *                         and with {@link TripleError.CodecFailed} for undecodable messages
     */
    public <T> T receiveMessage(Class<T> type) {
        var inbound = stream.receive(context);

        if (inbound instanceof Inbound.Closed closed) {
            throw closed.reason().exception();
        }
        if (inbound instanceof Inbound.Aborted aborted) {
            throw aborted.reason().exception();
        }

        var frame = ((Inbound.Message) inbound).frame();
        var payload = packageHandler.frameToPkgData(frame.payload());

        try {
            return serializer.unmarshal(payload, type);
        } catch (TripleException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to unmarshal {} bytes into {} on stream {}", payload.length, type.getName(), stream.path(), e);
            throw new TripleError.CodecFailed("unmarshal", type.getName(), e).exception();
        }
    }

    /**
     * Client side: response headers. Always empty.
     */
    public Map<String, String> header() {
        requireRole(StreamRole.CLIENT, "header");
        return Map.of();
    }

    /**
     * Client side: response trailers. Always empty.
     */
    public Map<String, String> trailer() {
        requireRole(StreamRole.CLIENT, "trailer");
        return Map.of();
    }

    /**
     * Client side: does nothing. Half-close the underlying stream with {@code stream().send(Frame.close())}.
     */
    public void closeSend() {
        requireRole(StreamRole.CLIENT, "closeSend");
    }

    /**
     * Server side: does nothing.
     */
    public void setHeader(Map<String, String> headers) {
        requireRole(StreamRole.SERVER, "setHeader");
    }

    /**
     * Server side: does nothing.
     */
    public void sendHeader(Map<String, String> headers) {
        requireRole(StreamRole.SERVER, "sendHeader");
    }

    /**
     * Server side: does nothing.
     */
    public void setTrailer(Map<String, String> trailers) {
        requireRole(StreamRole.SERVER, "setTrailer");
    }

    @Override
    public void close() {
        stream.close();
    }

    private void requireRole(StreamRole expected, String operation) {
        if (role != expected) {
            throw new IllegalStateException(operation + " is not available on a " + role + " stream");
        }
    }
}
