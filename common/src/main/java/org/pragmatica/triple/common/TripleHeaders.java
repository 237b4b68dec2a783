package org.pragmatica.triple.common;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Header names and fixed values of the Triple protocol.
 */
public final class TripleHeaders {
    public static final String CONTENT_TYPE = "content-type";
    public static final String TE = "te";
    public static final String USER_AGENT = "user-agent";
    public static final String GRPC_TIMEOUT = "grpc-timeout";
    public static final String GRPC_STATUS = "grpc-status";
    public static final String GRPC_MESSAGE = "grpc-message";

    public static final String TRIPLE_REQUEST_ID = "tri-req-id";
    public static final String TRIPLE_SERVICE_GROUP = "tri-service-group";
    public static final String TRIPLE_SERVICE_VERSION = "tri-service-version";

    public static final String GRPC_CONTENT_TYPE = "application/grpc+proto";
    public static final String TRAILERS = "trailers";
    public static final String TRIPLE_USER_AGENT = "triple-java/0.1";

    private TripleHeaders() {}

    /**
     * Build the request path of a call: {@code /interfaceKey/methodName}.
     */
    public static String path(String interfaceKey, String methodName) {
        return "/" + interfaceKey + "/" + methodName;
    }

    private static final long MAX_TIMEOUT_AMOUNT = 99_999_999L;
    private static final long[] UNIT_MILLIS = {1L, 1_000L, 60_000L, 3_600_000L};
    private static final char[] UNIT_NAMES = {'m', 'S', 'M', 'H'};

    /**
     * Encode a timeout as a {@code grpc-timeout} value. Milliseconds are used while they fit into
     * 8 digits, then seconds, minutes and hours, rounding up. Longer timeouts are capped at
     * {@code 99999999H}.
     */
    public static String grpcTimeout(long millis) {
        var value = Math.max(millis, 0);

        for (int i = 0; i < UNIT_MILLIS.length; i++) {
            var amount = ceilDiv(value, UNIT_MILLIS[i]);

            if (amount <= MAX_TIMEOUT_AMOUNT) {
                return amount + String.valueOf(UNIT_NAMES[i]);
            }
        }
        return MAX_TIMEOUT_AMOUNT + "H";
    }

    private static long ceilDiv(long value, long divisor) {
        return value / divisor + (value % divisor == 0 ? 0 : 1);
    }

    /**
     * Parse a {@code grpc-timeout} value: up to 8 digits followed by one of {@code H M S m u n}.
     */
    public static Optional<Duration> parseGrpcTimeout(CharSequence value) {
        if (value == null || value.length() < 2 || value.length() > 9) {
            return Optional.empty();
        }

        var text = value.toString();
        long amount;
        try {
            amount = Long.parseLong(text.substring(0, text.length() - 1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        return switch (text.charAt(text.length() - 1)) {
            case 'H' -> Optional.of(Duration.ofHours(amount));
            case 'M' -> Optional.of(Duration.ofMinutes(amount));
            case 'S' -> Optional.of(Duration.ofSeconds(amount));
            case 'm' -> Optional.of(Duration.ofMillis(amount));
            case 'u' -> Optional.of(Duration.ofNanos(amount * 1_000));
            case 'n' -> Optional.of(Duration.ofNanos(amount));
            default -> Optional.empty();
        };
    }

    /**
     * Percent-encode a {@code grpc-message} value. Printable ASCII other than {@code %} is kept as is.
     */
    public static String encodeMessage(String message) {
        var builder = new StringBuilder(message.length());

        for (var b : message.getBytes(StandardCharsets.UTF_8)) {
            if (b >= ' ' && b <= '~' && b != '%') {
                builder.append((char) b);
            } else {
                builder.append('%').append(String.format("%02X", b & 0xFF));
            }
        }
        return builder.toString();
    }

    public static String decodeMessage(CharSequence encoded) {
        if (encoded == null) {
            return "";
        }

        var out = new ByteArrayOutputStream(encoded.length());

        for (int i = 0; i < encoded.length(); i++) {
            var c = encoded.charAt(i);

            if (c == '%' && i + 2 < encoded.length()) {
                var high = Character.digit(encoded.charAt(i + 1), 16);
                var low = Character.digit(encoded.charAt(i + 2), 16);

                if (high >= 0 && low >= 0) {
                    out.write(high << 4 | low);
                    i += 2;
                    continue;
                }
            }
            out.write((byte) c);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
