package org.pragmatica.triple.common;

/**
 * Unchecked carrier for a {@link TripleError}.
 */
public class TripleException extends RuntimeException {
    private final TripleError error;

    public TripleException(TripleError error) {
        super(error.message(), causeOf(error));
        this.error = error;
    }

    public TripleError error() {
        return error;
    }

    private static Throwable causeOf(TripleError error) {
        if (error instanceof TripleError.ConnectFailed connectFailed) {
            return connectFailed.cause();
        }
        if (error instanceof TripleError.BindFailed bindFailed) {
            return bindFailed.cause();
        }
        if (error instanceof TripleError.CodecFailed codecFailed) {
            return codecFailed.cause();
        }
        return null;
    }
}
