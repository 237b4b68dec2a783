package org.pragmatica.triple.client;

import org.pragmatica.triple.common.TripleError;

import java.util.Optional;

/**
 * Outcome of {@link TripleClient#invoke}: the reply value on success, or {@code null} and the error on failure.
 */
public record InvocationResult(Object value, Optional<TripleError> error) {

    public static InvocationResult success(Object value) {
        return new InvocationResult(value, Optional.empty());
    }

    public static InvocationResult failure(TripleError error) {
        return new InvocationResult(null, Optional.of(error));
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }

    /**
     * Reply value cast to the expected type.
     *
     * @throws ClassCastException if the value is of another type
     */
    public <T> T valueAs(Class<T> type) {
        return type.cast(value);
    }
}
