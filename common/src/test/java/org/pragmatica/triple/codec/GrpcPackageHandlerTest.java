package org.pragmatica.triple.codec;

import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrpcPackageHandlerTest {
    private final PackageHandler handler = PackageHandler.grpcPackageHandler();

    @Test
    void pkgToFrameData_prefixesFlagAndLength() {
        var frame = handler.pkgToFrameData("abc".getBytes(StandardCharsets.UTF_8));

        assertThat(frame).containsExactly(0, 0, 0, 0, 3, 'a', 'b', 'c');
    }

    @Test
    void frameToPkgData_restoresPayload() {
        var payload = "laurence".getBytes(StandardCharsets.UTF_8);

        assertThat(handler.frameToPkgData(handler.pkgToFrameData(payload))).isEqualTo(payload);
    }

    @Test
    void emptyPayload_isAValidMessage() {
        var frame = handler.pkgToFrameData(new byte[0]);

        assertThat(frame).hasSize(5);
        assertThat(handler.frameToPkgData(frame)).isEmpty();
    }

    @Test
    void frameToPkgData_fails_whenFrameIsTruncated() {
        assertThatThrownBy(() -> handler.frameToPkgData(new byte[]{0, 0, 0}))
                .isInstanceOf(TripleException.class)
                .satisfies(e -> assertThat(((TripleException) e).error()).isInstanceOf(TripleError.CodecFailed.class));
    }

    @Test
    void frameToPkgData_fails_whenLengthDoesNotMatch() {
        assertThatThrownBy(() -> handler.frameToPkgData(new byte[]{0, 0, 0, 0, 9, 1, 2}))
                .isInstanceOf(TripleException.class)
                .hasMessageContaining("declared length 9");
    }

    @Test
    void frameToPkgData_fails_whenCompressed() {
        assertThatThrownBy(() -> handler.frameToPkgData(new byte[]{1, 0, 0, 0, 0}))
                .isInstanceOf(TripleException.class)
                .hasMessageContaining("compressed");
    }

    @Test
    void completeFrameLength_waitsForWholeMessage() {
        var frame = handler.pkgToFrameData(new byte[]{7, 8, 9});
        var buffer = Unpooled.buffer();

        buffer.writeBytes(frame, 0, 4);
        assertThat(handler.completeFrameLength(buffer)).isEqualTo(-1);

        buffer.writeBytes(frame, 4, 3);
        assertThat(handler.completeFrameLength(buffer)).isEqualTo(-1);

        buffer.writeBytes(frame, 7, 1);
        assertThat(handler.completeFrameLength(buffer)).isEqualTo(8);
        assertThat(buffer.readerIndex()).isZero();

        buffer.release();
    }

    @Test
    void completeFrameLength_reportsFirstOfSeveralMessages() {
        var buffer = Unpooled.buffer();
        buffer.writeBytes(handler.pkgToFrameData(new byte[]{1}));
        buffer.writeBytes(handler.pkgToFrameData(new byte[]{2, 3}));

        assertThat(handler.completeFrameLength(buffer)).isEqualTo(6);

        buffer.skipBytes(6);
        assertThat(handler.completeFrameLength(buffer)).isEqualTo(7);

        buffer.release();
    }

    @Test
    void declaredPayloadLength_isKnownBeforePayloadArrives() {
        var buffer = Unpooled.buffer();
        buffer.writeByte(0);

        assertThat(handler.declaredPayloadLength(buffer)).isEqualTo(-1);

        buffer.writeInt(5_000_000);

        assertThat(handler.declaredPayloadLength(buffer)).isEqualTo(5_000_000);
        assertThat(handler.completeFrameLength(buffer)).isEqualTo(-1);
        assertThat(buffer.readerIndex()).isZero();

        buffer.release();
    }

    @Test
    void frame_equalityComparesPayloadContent() {
        assertThat(Frame.data(new byte[]{1, 2})).isEqualTo(Frame.data(new byte[]{1, 2}));
        assertThat(Frame.data(new byte[0])).isNotEqualTo(Frame.close());
    }
}
