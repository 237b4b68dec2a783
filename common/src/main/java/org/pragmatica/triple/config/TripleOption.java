package org.pragmatica.triple.config;

import org.pragmatica.triple.serialization.ClassRegistrator;
import org.pragmatica.triple.serialization.SerializerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Connection and protocol options of a Triple client or server.
 * <p>
 * Fields left unset ({@code null} or zero) are filled with defaults by {@link #validate()}.
 * Header fields have no default and are passed through verbatim.
 *
 * @param timeout            call timeout and connect timeout
 * @param bufferSize         read buffer size of the connection, in bytes
 * @param location           target (client) or listening (server) address, {@code host:port}
 * @param protocol           protocol identifier
 * @param serializerType     serializer identifier, see {@link SerializerType}
 * @param headerGroup        value of the {@code tri-service-group} header
 * @param headerAppVersion   value of the {@code tri-service-version} header
 * @param logger             logger used by the client, connection controller and user streams
 * @param classRegistrators  class registrations applied to the dynamic serializers
 */
public record TripleOption(Duration timeout,
                           int bufferSize,
                           String location,
                           String protocol,
                           String serializerType,
                           String headerGroup,
                           String headerAppVersion,
                           Logger logger,
                           List<ClassRegistrator> classRegistrators) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_BUFFER_SIZE = 4096;
    public static final String DEFAULT_LOCATION = "127.0.0.1:20001";
    public static final String TRIPLE = "tri";
    public static final String DEFAULT_LOGGER_NAME = "triple";

    /**
     * Mutation applied when building an option.
     */
    @FunctionalInterface
    public interface OptionFunction {
        TripleOption apply(TripleOption option);
    }

    /**
     * Option with every field unset.
     */
    public static TripleOption empty() {
        return new TripleOption(null, 0, null, null, null, null, null, null, List.of());
    }

    /**
     * Build an option from the given functions, applied in order. The result is not validated.
     */
    public static TripleOption tripleOption(OptionFunction... functions) {
        var option = empty();

        for (var function : functions) {
            option = function.apply(option);
        }
        return option;
    }

    /**
     * Fill unset fields with defaults.
     */
    public TripleOption validate() {
        return new TripleOption(timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout,
                                bufferSize <= 0 ? DEFAULT_BUFFER_SIZE : bufferSize,
                                isBlank(location) ? DEFAULT_LOCATION : location,
                                isBlank(protocol) ? TRIPLE : protocol,
                                isBlank(serializerType) ? SerializerType.PROTOBUF : serializerType,
                                headerGroup,
                                headerAppVersion,
                                logger == null ? LoggerFactory.getLogger(DEFAULT_LOGGER_NAME) : logger,
                                classRegistrators == null ? List.of() : List.copyOf(classRegistrators));
    }

    public static OptionFunction withTimeout(Duration timeout) {
        return o -> new TripleOption(timeout, o.bufferSize, o.location, o.protocol, o.serializerType,
                                     o.headerGroup, o.headerAppVersion, o.logger, o.classRegistrators);
    }

    public static OptionFunction withBufferSize(int size) {
        return o -> new TripleOption(o.timeout, size, o.location, o.protocol, o.serializerType,
                                     o.headerGroup, o.headerAppVersion, o.logger, o.classRegistrators);
    }

    /**
     * Serializer identifier, {@code "protobuf"}, {@code "fury"} or {@code "kryo"}.
     */
    public static OptionFunction withSerializerType(String serializerType) {
        return o -> new TripleOption(o.timeout, o.bufferSize, o.location, o.protocol, serializerType,
                                     o.headerGroup, o.headerAppVersion, o.logger, o.classRegistrators);
    }

    public static OptionFunction withProtocol(String protocol) {
        return o -> new TripleOption(o.timeout, o.bufferSize, o.location, protocol, o.serializerType,
                                     o.headerGroup, o.headerAppVersion, o.logger, o.classRegistrators);
    }

    /**
     * Address such as {@code "127.0.0.1:20001"}.
     */
    public static OptionFunction withLocation(String location) {
        return o -> new TripleOption(o.timeout, o.bufferSize, location, o.protocol, o.serializerType,
                                     o.headerGroup, o.headerAppVersion, o.logger, o.classRegistrators);
    }

    public static OptionFunction withHeaderAppVersion(String appVersion) {
        return o -> new TripleOption(o.timeout, o.bufferSize, o.location, o.protocol, o.serializerType,
                                     o.headerGroup, appVersion, o.logger, o.classRegistrators);
    }

    public static OptionFunction withHeaderGroup(String group) {
        return o -> new TripleOption(o.timeout, o.bufferSize, o.location, o.protocol, o.serializerType,
                                     group, o.headerAppVersion, o.logger, o.classRegistrators);
    }

    public static OptionFunction withLogger(Logger logger) {
        return o -> new TripleOption(o.timeout, o.bufferSize, o.location, o.protocol, o.serializerType,
                                     o.headerGroup, o.headerAppVersion, logger, o.classRegistrators);
    }

    public static OptionFunction withClassRegistrators(ClassRegistrator... registrators) {
        return o -> new TripleOption(o.timeout, o.bufferSize, o.location, o.protocol, o.serializerType,
                                     o.headerGroup, o.headerAppVersion, o.logger, List.of(registrators));
    }

    /**
     * Host part of {@link #location()}.
     */
    public String host() {
        return Address.parse(location).host();
    }

    /**
     * Port part of {@link #location()}.
     */
    public int port() {
        return Address.parse(location).port();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
