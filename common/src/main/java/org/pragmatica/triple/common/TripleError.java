package org.pragmatica.triple.common;

import java.time.Duration;

/**
 * Error types for Triple transport and invocation operations.
 * <p>
 * Errors are plain values. Blocking APIs surface them by throwing {@link TripleException},
 * see {@link #exception()}.
 */
public sealed interface TripleError {

    /**
     * Human-readable description of the error.
     */
    String message();

    /**
     * Wrap this error into an unchecked exception suitable for throwing from blocking calls.
     */
    default TripleException exception() {
        return new TripleException(this);
    }

    /**
     * Configuration is unusable (missing interface key, malformed address, bad option value).
     */
    record InvalidConfiguration(String reason) implements TripleError {
        @Override
        public String message() {
            return "Invalid triple configuration: " + reason;
        }
    }

    /**
     * Serializer type identifier is not recognized.
     */
    record UnknownSerializer(String serializerType) implements TripleError {
        @Override
        public String message() {
            return "Invalid triple client serializerType = " + serializerType;
        }
    }

    /**
     * Physical connection could not be established.
     */
    record ConnectFailed(String address, Throwable cause) implements TripleError {
        @Override
        public String message() {
            return "Failed to connect to " + address + ": " + cause.getMessage();
        }
    }

    /**
     * Server could not bind its listening socket.
     */
    record BindFailed(String address, Throwable cause) implements TripleError {
        @Override
        public String message() {
            return "Failed to bind to " + address + ": " + cause.getMessage();
        }
    }

    /**
     * Connection controller was destroyed or the connection is lost.
     */
    record ConnectionUnavailable(String address) implements TripleError {
        @Override
        public String message() {
            return "Connection to " + address + " is not available";
        }
    }

    /**
     * Receive or send against a closed stream.
     */
    record StreamClosed(int streamId) implements TripleError {
        @Override
        public String message() {
            return "User stream " + streamId + " closed";
        }
    }

    /**
     * Remote side finished the call with a non-OK status.
     */
    record RemoteFailure(GrpcStatus status, String description) implements TripleError {
        @Override
        public String message() {
            return "Remote call failed with status " + status + (description.isEmpty() ? "" : ": " + description);
        }
    }

    /**
     * Marshal or unmarshal failure.
     *
     * @param operation what was attempted, e.g. "marshal" or "unframe"
     * @param subject   offending message or a description of the payload
     * @param cause     underlying codec exception
     */
    record CodecFailed(String operation, Object subject, Throwable cause) implements TripleError {
        @Override
        public String message() {
            return "Failed to " + operation + " " + subject + ": " + cause.getMessage();
        }
    }

    /**
     * Method name is not present in the client dispatch table.
     */
    record MethodNotFound(String methodName) implements TripleError {
        @Override
        public String message() {
            return "Method " + methodName + " is not bound";
        }
    }

    /**
     * Call deadline passed while waiting.
     */
    record DeadlineExceeded(Duration timeout) implements TripleError {
        @Override
        public String message() {
            return "Deadline exceeded after " + timeout.toMillis() + "ms";
        }
    }

    /**
     * Call was cancelled through its context.
     */
    record Cancelled() implements TripleError {
        @Override
        public String message() {
            return "Call cancelled";
        }
    }

    /**
     * Waiting thread was interrupted.
     */
    record Interrupted() implements TripleError {
        @Override
        public String message() {
            return "Interrupted while waiting for stream data";
        }
    }
}
