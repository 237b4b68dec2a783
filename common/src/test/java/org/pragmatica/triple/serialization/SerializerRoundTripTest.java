package org.pragmatica.triple.serialization;

import com.google.protobuf.Int64Value;
import com.google.protobuf.StringValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.common.TripleException;
import org.pragmatica.triple.serialization.Samples.HelloRequest;
import org.pragmatica.triple.serialization.Samples.User;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerializerRoundTripTest {

    private static final User USER = Samples.user();

    @Nested
    class Protobuf {
        private final TripleSerializer serializer = ProtobufSerializer.protobufSerializer();

        @Test
        void roundTrip_succeeds_forWrapperMessage() {
            var message = StringValue.of("laurence");

            var restored = serializer.unmarshal(serializer.marshal(message), StringValue.class);

            assertThat(restored).isEqualTo(message);
        }

        @Test
        void roundTrip_succeeds_forNestedStruct() {
            var message = Struct.newBuilder()
                                .putFields("name", Value.newBuilder().setStringValue("laurence").build())
                                .putFields("age", Value.newBuilder().setNumberValue(21).build())
                                .build();

            assertThat(serializer.unmarshal(serializer.marshal(message), Struct.class)).isEqualTo(message);
        }

        @Test
        void marshal_fails_forNonProtobufObject() {
            assertThatThrownBy(() -> serializer.marshal(new HelloRequest("laurence")))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(((TripleException) e).error()).isInstanceOf(TripleError.CodecFailed.class));
        }

        @Test
        void unmarshal_fails_forGarbage() {
            assertThatThrownBy(() -> serializer.unmarshal(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF}, Int64Value.class))
                    .isInstanceOf(TripleException.class)
                    .hasMessageContaining("unmarshal");
        }

        @Test
        void unmarshal_fails_forNonProtobufType() {
            assertThatThrownBy(() -> serializer.unmarshal(new byte[0], Object.class))
                    .isInstanceOf(TripleException.class);
        }
    }

    @Nested
    class Fury {
        private final TripleSerializer serializer =
                SerializerType.serializer(SerializerType.FURY, List.of(Samples.records())).orElseThrow();

        @Test
        void roundTrip_succeeds_forRecordGraph() {
            assertThat(serializer.unmarshal(serializer.marshal(USER), Object.class)).isEqualTo(USER);
        }

        @Test
        void roundTrip_succeeds_forRegisteredType() {
            var request = new HelloRequest("laurence");

            assertThat(serializer.unmarshal(serializer.marshal(request), HelloRequest.class)).isEqualTo(request);
        }

        @Test
        void marshal_fails_forUnregisteredType() {
            var userOnly = SerializerType.serializer(SerializerType.FURY, List.of(registrar -> registrar.accept(User.class)))
                                         .orElseThrow();

            assertThatThrownBy(() -> userOnly.marshal(new HelloRequest("mallory")))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(((TripleException) e).error()).isInstanceOf(TripleError.CodecFailed.class));
        }

        @Test
        void unmarshal_fails_forWrongType() {
            var bytes = serializer.marshal("text");

            assertThatThrownBy(() -> serializer.unmarshal(bytes, Integer.class))
                    .isInstanceOf(TripleException.class);
        }
    }

    @Nested
    class Kryo {
        private final TripleSerializer serializer =
                SerializerType.serializer(SerializerType.KRYO, List.of(Samples.records(), Samples.collections()))
                              .orElseThrow();

        @Test
        void roundTrip_succeeds_forRecordGraph() {
            assertThat(serializer.unmarshal(serializer.marshal(USER), User.class)).isEqualTo(USER);
        }

        @Test
        void marshal_fails_forUnregisteredType() {
            var recordsOnly = SerializerType.serializer(SerializerType.KRYO, List.of(Samples.records())).orElseThrow();

            assertThatThrownBy(() -> recordsOnly.marshal(USER))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(((TripleException) e).error()).isInstanceOf(TripleError.CodecFailed.class));
        }

        @Test
        void roundTrip_succeeds_forNull() {
            assertThat(serializer.unmarshal(serializer.marshal(null), Object.class)).isNull();
        }

        @Test
        void unmarshal_fails_forEmptyInput() {
            assertThatThrownBy(() -> serializer.unmarshal(new byte[0], Object.class))
                    .isInstanceOf(TripleException.class)
                    .satisfies(e -> assertThat(((TripleException) e).error()).isInstanceOf(TripleError.CodecFailed.class));
        }
    }

    @Test
    void serializer_isEmpty_forUnknownType() {
        assertThat(SerializerType.serializer("hessian3", List.of())).isEmpty();
        assertThat(SerializerType.isKnown("hessian3")).isFalse();
    }

    @Test
    void serializerTypes_areClassified() {
        assertThat(SerializerType.isSchema(SerializerType.PROTOBUF)).isTrue();
        assertThat(SerializerType.isDynamic(SerializerType.FURY)).isTrue();
        assertThat(SerializerType.isDynamic(SerializerType.KRYO)).isTrue();
        assertThat(SerializerType.isDynamic(SerializerType.PROTOBUF)).isFalse();
    }
}
