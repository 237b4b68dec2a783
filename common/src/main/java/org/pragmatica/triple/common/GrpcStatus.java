package org.pragmatica.triple.common;

/**
 * gRPC status codes used in the {@code grpc-status} trailer.
 */
public enum GrpcStatus {
    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    private static final GrpcStatus[] BY_CODE = values();

    private final int code;

    GrpcStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolve the status from a code, mapping anything unrecognized to {@link #UNKNOWN}.
     */
    public static GrpcStatus fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return UNKNOWN;
        }
        return BY_CODE[code];
    }

    /**
     * Parse the textual trailer value.
     */
    public static GrpcStatus fromHeader(CharSequence value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return fromCode(Integer.parseInt(value.toString().trim()));
        } catch (NumberFormatException e) {
            return UNKNOWN;
        }
    }

    public String asHeader() {
        return Integer.toString(code);
    }

    /**
     * Status reported to the remote side for a failure.
     */
    public static GrpcStatus forError(TripleError error) {
        if (error instanceof TripleError.RemoteFailure remoteFailure) {
            return remoteFailure.status();
        }
        if (error instanceof TripleError.DeadlineExceeded) {
            return DEADLINE_EXCEEDED;
        }
        if (error instanceof TripleError.Cancelled || error instanceof TripleError.StreamClosed) {
            return CANCELLED;
        }
        if (error instanceof TripleError.CodecFailed) {
            return INTERNAL;
        }
        if (error instanceof TripleError.MethodNotFound) {
            return UNIMPLEMENTED;
        }
        if (error instanceof TripleError.ConnectionUnavailable || error instanceof TripleError.ConnectFailed) {
            return UNAVAILABLE;
        }
        return UNKNOWN;
    }
}
