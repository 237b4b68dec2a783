package org.pragmatica.triple.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tagged unit of stream data. For {@link MessageType#DATA} the payload holds one message in
 * wire form, as produced by {@link PackageHandler#pkgToFrameData(byte[])}.
 */
public record Frame(MessageType type, byte[] payload) {
    private static final byte[] NO_BYTES = new byte[0];
    private static final Frame CLOSE = new Frame(MessageType.CLOSE, NO_BYTES);

    public Frame {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? NO_BYTES : payload;
    }

    public static Frame data(byte[] payload) {
        return new Frame(MessageType.DATA, payload);
    }

    public static Frame close() {
        return CLOSE;
    }

    public boolean isData() {
        return type == MessageType.DATA;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Frame other && type == other.type && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame{" + type + ", " + payload.length + " bytes}";
    }
}
