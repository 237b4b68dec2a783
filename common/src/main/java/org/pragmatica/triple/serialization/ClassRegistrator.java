package org.pragmatica.triple.serialization;

import java.util.function.Consumer;

/** Registers application classes with a dynamic serializer. */
@FunctionalInterface
public interface ClassRegistrator {
    void registerClasses(Consumer<Class<?>> registrator);
}
