package org.pragmatica.triple.serialization;

import org.pragmatica.triple.serialization.fury.FurySerializer;
import org.pragmatica.triple.serialization.kryo.KryoSerializer;

import java.util.List;
import java.util.Optional;

/**
 * Serializer identifiers accepted in {@code TripleOption.serializerType}.
 */
public final class SerializerType {
    /** Structured, schema-based codec (protocol buffers). */
    public static final String PROTOBUF = "protobuf";
    /** Dynamic object-graph codec backed by Apache Fury. */
    public static final String FURY = "fury";
    /** Dynamic object-graph codec backed by Kryo. */
    public static final String KRYO = "kryo";

    private SerializerType() {}

    public static boolean isSchema(String type) {
        return PROTOBUF.equals(type);
    }

    public static boolean isDynamic(String type) {
        return FURY.equals(type) || KRYO.equals(type);
    }

    public static boolean isKnown(String type) {
        return isSchema(type) || isDynamic(type);
    }

    /**
     * Create the serializer for an identifier, or empty if the identifier is unknown.
     */
    public static Optional<TripleSerializer> serializer(String type, List<ClassRegistrator> registrators) {
        if (type == null) {
            return Optional.empty();
        }

        var registratorArray = registrators.toArray(ClassRegistrator[]::new);

        return switch (type) {
            case PROTOBUF -> Optional.of(ProtobufSerializer.protobufSerializer());
            case FURY -> Optional.of(FurySerializer.furySerializer(registratorArray));
            case KRYO -> Optional.of(KryoSerializer.kryoSerializer(registratorArray));
            default -> Optional.empty();
        };
    }
}
