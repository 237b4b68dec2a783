package org.pragmatica.triple.serialization;

/**
 * Converts call arguments and results to and from payload bytes.
 * <p>
 * Implementations hold no per-call state and are safe for concurrent use.
 */
public interface TripleSerializer {

    /**
     * Serializer identifier, see {@link SerializerType}.
     */
    String type();

    /**
     * @throws org.pragmatica.triple.common.TripleException with
     *         {@link org.pragmatica.triple.common.TripleError.CodecFailed}
     */
    byte[] marshal(Object message);

    /**
     * @param type expected result type; dynamic serializers accept {@code Object.class}
     * @throws org.pragmatica.triple.common.TripleException with
     *         {@link org.pragmatica.triple.common.TripleError.CodecFailed}
     */
    <T> T unmarshal(byte[] data, Class<T> type);
}
