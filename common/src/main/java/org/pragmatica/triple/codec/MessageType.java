package org.pragmatica.triple.codec;

/**
 * Kind of a {@link Frame}.
 */
public enum MessageType {
    /** Carries one length-prefixed message. */
    DATA,
    /** Control signal: the sender is done sending on this stream. */
    CLOSE
}
