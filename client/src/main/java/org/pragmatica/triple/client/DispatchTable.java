package org.pragmatica.triple.client;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name-to-method table built once when the client is created.
 */
public interface DispatchTable {

    Optional<StubMethod> lookup(String methodName);

    Set<String> methodNames();

    static DispatchTable dispatchTable(Map<String, StubMethod> methods) {
        record dispatchTable(Map<String, StubMethod> methods) implements DispatchTable {
            @Override
            public Optional<StubMethod> lookup(String methodName) {
                return Optional.ofNullable(methods.get(methodName));
            }

            @Override
            public Set<String> methodNames() {
                return methods.keySet();
            }
        }

        return new dispatchTable(Map.copyOf(methods));
    }

    static DispatchTable empty() {
        return dispatchTable(Map.of());
    }
}
