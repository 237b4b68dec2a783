package org.pragmatica.triple.transport;

/**
 * Side of the call a stream belongs to.
 */
public enum StreamRole {
    CLIENT,
    SERVER
}
