package org.pragmatica.triple.transport;

import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.common.TripleError;

/**
 * Outcome of {@link TripleStream#receive}.
 * <p>
 * Stream closure is a distinct outcome, so a zero-length payload is always a real message.
 */
public sealed interface Inbound {

    /**
     * Next message of the stream.
     */
    record Message(Frame frame) implements Inbound {}

    /**
     * The stream is closed. Returned for every receive once observed.
     *
     * @param reason {@link TripleError.StreamClosed} for a normal end of stream, otherwise the failure
     *               which closed it
     */
    record Closed(TripleError reason) implements Inbound {}

    /**
     * The wait was abandoned because of deadline, cancellation or interruption. The stream stays usable.
     */
    record Aborted(TripleError reason) implements Inbound {}
}
