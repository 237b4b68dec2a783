package org.pragmatica.triple.serialization;

import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;
import org.pragmatica.triple.common.TripleError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schema-based serializer for protocol buffer messages.
 * <p>
 * Parsers are looked up once per message class through its static {@code getDefaultInstance()}.
 */
public interface ProtobufSerializer extends TripleSerializer {

    static ProtobufSerializer protobufSerializer() {
        record protobufSerializer(Map<Class<?>, Parser<?>> parsers) implements ProtobufSerializer {
            private static final Logger log = LoggerFactory.getLogger(ProtobufSerializer.class);

            @Override
            public String type() {
                return SerializerType.PROTOBUF;
            }

            @Override
            public byte[] marshal(Object message) {
                if (!(message instanceof MessageLite messageLite)) {
                    log.error("Error serializing {}: not a protobuf message", typeName(message));
                    throw new TripleError.CodecFailed("marshal", message,
                                                      new IllegalArgumentException("not a protobuf message: "
                                                                                   + typeName(message))).exception();
                }
                return messageLite.toByteArray();
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                try {
                    return type.cast(parser(type).parseFrom(data));
                } catch (Exception e) {
                    log.error("Error deserializing {} bytes into {}", data.length, type.getName(), e);
                    throw new TripleError.CodecFailed("unmarshal", type.getName(), e).exception();
                }
            }

            private Parser<?> parser(Class<?> type) {
                return parsers.computeIfAbsent(type, protobufSerializer::lookupParser);
            }

            private static Parser<?> lookupParser(Class<?> type) {
                if (!MessageLite.class.isAssignableFrom(type)) {
                    throw new IllegalArgumentException(type.getName() + " is not a protobuf message type");
                }
                try {
                    var defaultInstance = (MessageLite) type.getMethod("getDefaultInstance").invoke(null);
                    return defaultInstance.getParserForType();
                } catch (ReflectiveOperationException e) {
                    throw new IllegalArgumentException("No default instance for " + type.getName(), e);
                }
            }

            private static String typeName(Object message) {
                return message == null ? "null" : message.getClass().getName();
            }
        }

        return new protobufSerializer(new ConcurrentHashMap<>());
    }
}
