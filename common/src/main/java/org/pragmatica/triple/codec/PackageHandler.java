package org.pragmatica.triple.codec;

import io.netty.buffer.ByteBuf;

/**
 * Translates serialized payloads to and from their wire form.
 * <p>
 * Implementations are stateless and shared between streams. {@code frameToPkgData(pkgToFrameData(x))}
 * must return {@code x} for any byte sequence.
 */
public interface PackageHandler {

    /**
     * Wrap a serialized payload into its wire form.
     */
    byte[] pkgToFrameData(byte[] pkg);

    /**
     * Extract the payload from one complete message in wire form.
     *
     * @throws org.pragmatica.triple.common.TripleException with
     *         {@link org.pragmatica.triple.common.TripleError.CodecFailed} when the data is malformed
     */
    byte[] frameToPkgData(byte[] frame);

    /**
     * Length in bytes of the next complete message at the reader index of {@code buffer},
     * header included, or {@code -1} if the buffer does not hold a complete message yet.
     * Does not move the reader index.
     */
    int completeFrameLength(ByteBuf buffer);

    /**
     * Payload length announced by the message header at the reader index of {@code buffer}, or
     * {@code -1} if the header is not complete yet. Does not move the reader index.
     */
    int declaredPayloadLength(ByteBuf buffer);

    /**
     * The gRPC length-prefixed message format.
     */
    static PackageHandler grpcPackageHandler() {
        return GrpcPackageHandler.INSTANCE;
    }
}
