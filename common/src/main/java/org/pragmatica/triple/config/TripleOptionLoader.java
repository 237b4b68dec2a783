package org.pragmatica.triple.config;

import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.config.TripleOption.OptionFunction;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds a validated {@link TripleOption} from flat properties.
 *
 * <p>Recognized keys:
 * <ul>
 *   <li>{@code triple.timeout} - ISO-8601 duration ({@code PT5S}) or milliseconds</li>
 *   <li>{@code triple.buffer-size} - bytes</li>
 *   <li>{@code triple.location}, {@code triple.protocol}, {@code triple.serializer}</li>
 *   <li>{@code triple.group}, {@code triple.app-version}</li>
 * </ul>
 * Unknown keys are ignored. All malformed values are reported together.
 */
public final class TripleOptionLoader {
    public static final String TIMEOUT = "triple.timeout";
    public static final String BUFFER_SIZE = "triple.buffer-size";
    public static final String LOCATION = "triple.location";
    public static final String PROTOCOL = "triple.protocol";
    public static final String SERIALIZER = "triple.serializer";
    public static final String GROUP = "triple.group";
    public static final String APP_VERSION = "triple.app-version";

    private TripleOptionLoader() {}

    /**
     * Load options, apply {@code overrides} after the loaded values and validate the result.
     *
     * @throws org.pragmatica.triple.common.TripleException with {@link TripleError.InvalidConfiguration}
     */
    public static TripleOption load(Map<String, String> properties, OptionFunction... overrides) {
        var errors = new ArrayList<String>();
        var functions = new ArrayList<OptionFunction>();

        var timeout = properties.get(TIMEOUT);
        if (timeout != null) {
            parseDuration(timeout, errors).ifPresent(value -> functions.add(TripleOption.withTimeout(value)));
        }

        var bufferSize = properties.get(BUFFER_SIZE);
        if (bufferSize != null) {
            try {
                var size = Integer.parseInt(bufferSize.trim());
                if (size <= 0) {
                    errors.add("Buffer size must be positive. Got: " + bufferSize);
                } else {
                    functions.add(TripleOption.withBufferSize(size));
                }
            } catch (NumberFormatException e) {
                errors.add("Buffer size is not a number: " + bufferSize);
            }
        }

        var location = properties.get(LOCATION);
        if (location != null) {
            try {
                Address.parse(location.trim());
                functions.add(TripleOption.withLocation(location.trim()));
            } catch (RuntimeException e) {
                errors.add(e.getMessage());
            }
        }

        copy(properties, PROTOCOL, functions, TripleOption::withProtocol);
        copy(properties, SERIALIZER, functions, TripleOption::withSerializerType);
        copy(properties, GROUP, functions, TripleOption::withHeaderGroup);
        copy(properties, APP_VERSION, functions, TripleOption::withHeaderAppVersion);

        if (!errors.isEmpty()) {
            throw new TripleError.InvalidConfiguration(String.join("; ", errors)).exception();
        }

        functions.addAll(List.of(overrides));

        return TripleOption.tripleOption(functions.toArray(OptionFunction[]::new))
                           .validate();
    }

    private static Optional<Duration> parseDuration(String value, List<String> errors) {
        var trimmed = value.trim();
        try {
            if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
                return positive(Duration.parse(trimmed), value, errors);
            }
            return positive(Duration.ofMillis(Long.parseLong(trimmed)), value, errors);
        } catch (DateTimeParseException | NumberFormatException e) {
            errors.add("Invalid timeout: " + value);
            return Optional.empty();
        }
    }

    private static Optional<Duration> positive(Duration duration, String raw, List<String> errors) {
        if (duration.isZero() || duration.isNegative()) {
            errors.add("Timeout must be positive. Got: " + raw);
            return Optional.empty();
        }
        return Optional.of(duration);
    }

    private static void copy(Map<String, String> properties,
                             String key,
                             List<OptionFunction> functions,
                             Function<String, OptionFunction> factory) {
        var value = properties.get(key);

        if (value != null && !value.isBlank()) {
            functions.add(factory.apply(value.trim()));
        }
    }
}
