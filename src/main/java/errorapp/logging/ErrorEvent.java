package errorapp.logging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured error record handed to an {@link ErrorEventSink}.
 *
 * <p>Fields keep their insertion order so log lines read the same way every time.
 *
 * @param message short constant description, e.g. {@code "Infrastructure error"}
 * @param fields key/value context such as service name and request path
 * @param cause underlying failure for the stack trace, may be null
 */
public record ErrorEvent(String message, Map<String, String> fields, Throwable cause) {

    public ErrorEvent {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public ErrorEvent(final String message, final Map<String, String> fields) {
        this(message, fields, null);
    }
}
