package org.pragmatica.triple.transport.server;

/**
 * Socket options of a {@link TripleServer}.
 *
 * @param soBacklog   pending connection queue length of the listening socket (SO_BACKLOG)
 * @param soKeepalive TCP keepalive probes on accepted connections (SO_KEEPALIVE)
 * @param tcpNoDelay  disable Nagle's algorithm on accepted connections (TCP_NODELAY)
 */
public record SocketOptions(int soBacklog, boolean soKeepalive, boolean tcpNoDelay) {
    public static final int DEFAULT_BACKLOG = 128;

    public SocketOptions {
        if (soBacklog <= 0) {
            throw new IllegalArgumentException("Backlog must be positive. Got: " + soBacklog);
        }
    }

    public static SocketOptions socketOptions(int soBacklog, boolean soKeepalive, boolean tcpNoDelay) {
        return new SocketOptions(soBacklog, soKeepalive, tcpNoDelay);
    }

    public static SocketOptions defaults() {
        return new SocketOptions(DEFAULT_BACKLOG, true, true);
    }
}
