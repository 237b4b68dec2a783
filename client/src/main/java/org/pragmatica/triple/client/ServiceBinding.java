package org.pragmatica.triple.client;

import java.util.Map;

/**
 * Binds a service stub to a connection. Implemented by generated or hand-written stubs of schema-based
 * services; the resulting methods are dispatched by name.
 */
public interface ServiceBinding {

    /**
     * Interface key of the bound service, used to build call paths.
     */
    String interfaceKey();

    /**
     * Create the stub methods, keyed by method name.
     */
    Map<String, StubMethod> bind(TripleConnection connection);

    /**
     * Binding without methods, for clients of dynamic-codec services.
     */
    static ServiceBinding none() {
        record none() implements ServiceBinding {
            @Override
            public String interfaceKey() {
                return "";
            }

            @Override
            public Map<String, StubMethod> bind(TripleConnection connection) {
                return Map.of();
            }
        }

        return new none();
    }
}
