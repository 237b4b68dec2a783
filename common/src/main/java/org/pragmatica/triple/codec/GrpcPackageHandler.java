package org.pragmatica.triple.codec;

import io.netty.buffer.ByteBuf;
import org.pragmatica.triple.common.TripleError;

import java.nio.ByteBuffer;

/**
 * gRPC message framing: one compression flag byte (always 0, compression is not supported),
 * a 4-byte big-endian payload length, then the payload.
 */
final class GrpcPackageHandler implements PackageHandler {
    static final GrpcPackageHandler INSTANCE = new GrpcPackageHandler();

    static final int HEADER_LENGTH = 5;
    private static final byte UNCOMPRESSED = 0;

    private GrpcPackageHandler() {}

    @Override
    public byte[] pkgToFrameData(byte[] pkg) {
        return ByteBuffer.allocate(HEADER_LENGTH + pkg.length)
                         .put(UNCOMPRESSED)
                         .putInt(pkg.length)
                         .put(pkg)
                         .array();
    }

    @Override
    public byte[] frameToPkgData(byte[] frame) {
        if (frame.length < HEADER_LENGTH) {
            throw malformed(frame, "frame shorter than header");
        }

        var buffer = ByteBuffer.wrap(frame);
        var flag = buffer.get();

        if (flag != UNCOMPRESSED) {
            throw malformed(frame, "compressed messages are not supported");
        }

        var length = buffer.getInt();

        if (length < 0 || length != frame.length - HEADER_LENGTH) {
            throw malformed(frame, "declared length " + length + " does not match payload size " + (frame.length - HEADER_LENGTH));
        }

        var pkg = new byte[length];
        buffer.get(pkg);
        return pkg;
    }

    @Override
    public int completeFrameLength(ByteBuf buffer) {
        if (buffer.readableBytes() < HEADER_LENGTH) {
            return -1;
        }

        var length = buffer.getInt(buffer.readerIndex() + 1);

        if (length < 0) {
            throw malformed("inbound buffer", "negative message length " + length);
        }
        if (buffer.readableBytes() - HEADER_LENGTH < length) {
            return -1;
        }
        return HEADER_LENGTH + length;
    }

    @Override
    public int declaredPayloadLength(ByteBuf buffer) {
        if (buffer.readableBytes() < HEADER_LENGTH) {
            return -1;
        }
        return buffer.getInt(buffer.readerIndex() + 1);
    }

    private static RuntimeException malformed(Object subject, String reason) {
        return new TripleError.CodecFailed("unframe", describe(subject), new IllegalArgumentException(reason)).exception();
    }

    private static Object describe(Object subject) {
        return subject instanceof byte[] bytes ? bytes.length + " bytes" : subject;
    }
}
