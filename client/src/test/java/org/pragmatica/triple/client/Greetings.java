package org.pragmatica.triple.client;

import org.pragmatica.triple.serialization.ClassRegistrator;

/**
 * Message types of the dynamic-codec greeter used in client tests.
 */
public final class Greetings {
    public static final String INTERFACE_KEY = "com.example.IGreeter";

    private Greetings() {}

    public record HelloRequest(String name) {}

    public record HelloReply(String message) {}

    /**
     * Never registered with any serializer.
     */
    public record Stranger(String name) {}

    public static ClassRegistrator registrator() {
        return registrator -> {
            registrator.accept(HelloRequest.class);
            registrator.accept(HelloReply.class);
        };
    }
}
