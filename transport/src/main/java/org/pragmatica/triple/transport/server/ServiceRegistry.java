package org.pragmatica.triple.transport.server;

import org.pragmatica.triple.common.TripleHeaders;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Method handlers served by a {@link TripleServer}, keyed by call path.
 */
public final class ServiceRegistry {
    private final Map<String, MethodHandler> handlers = new ConcurrentHashMap<>();

    private ServiceRegistry() {}

    public static ServiceRegistry serviceRegistry() {
        return new ServiceRegistry();
    }

    /**
     * Register a handler for {@code /interfaceKey/methodName}, replacing any previous one.
     */
    public ServiceRegistry register(String interfaceKey, String methodName, MethodHandler handler) {
        handlers.put(TripleHeaders.path(interfaceKey, methodName), handler);
        return this;
    }

    public Optional<MethodHandler> lookup(String path) {
        return Optional.ofNullable(handlers.get(path));
    }

    public int size() {
        return handlers.size();
    }
}
