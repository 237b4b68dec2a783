package org.pragmatica.triple.serialization.fury;

import org.apache.fury.ThreadSafeFury;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.serialization.ClassRegistrator;
import org.pragmatica.triple.serialization.SerializerType;
import org.pragmatica.triple.serialization.TripleSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dynamic object-graph serializer backed by Apache Fury.
 */
public interface FurySerializer extends TripleSerializer {
    static FurySerializer furySerializer(ClassRegistrator... registrators) {
        record furySerializer(ThreadSafeFury fury) implements FurySerializer {
            private static final Logger log = LoggerFactory.getLogger(FurySerializer.class);

            @Override
            public String type() {
                return SerializerType.FURY;
            }

            @Override
            public byte[] marshal(Object message) {
                try {
                    return fury().serialize(message);
                } catch (Exception e) {
                    log.error("Error serializing object {}", message, e);
                    throw new TripleError.CodecFailed("marshal", message, e).exception();
                }
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                try {
                    return type.cast(fury().deserialize(data));
                } catch (Exception e) {
                    log.error("Error deserializing {} bytes", data.length, e);
                    throw new TripleError.CodecFailed("unmarshal", type.getName(), e).exception();
                }
            }
        }

        return new furySerializer(FuryFactory.fury(registrators));
    }
}
