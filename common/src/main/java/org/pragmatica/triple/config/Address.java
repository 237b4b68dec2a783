package org.pragmatica.triple.config;

import org.pragmatica.triple.common.TripleError;

/**
 * Parsed {@code host:port} address.
 */
public record Address(String host, int port) {

    /**
     * Parse an address of the form {@code host:port} or {@code [v6-host]:port}.
     *
     * @throws org.pragmatica.triple.common.TripleException with {@link TripleError.InvalidConfiguration}
     */
    public static Address parse(String location) {
        if (location == null || location.isBlank()) {
            throw new TripleError.InvalidConfiguration("address must not be empty").exception();
        }

        var separator = location.lastIndexOf(':');

        if (separator <= 0 || separator == location.length() - 1) {
            throw new TripleError.InvalidConfiguration("address must be host:port, got " + location).exception();
        }

        var host = location.substring(0, separator);

        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        try {
            var port = Integer.parseInt(location.substring(separator + 1));

            if (port < 0 || port > 65535) {
                throw new TripleError.InvalidConfiguration("port must be between 0 and 65535, got " + port).exception();
            }
            return new Address(host, port);
        } catch (NumberFormatException e) {
            throw new TripleError.InvalidConfiguration("port is not a number in " + location).exception();
        }
    }

    public String asString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
