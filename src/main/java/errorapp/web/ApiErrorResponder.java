package errorapp.web;

import errorapp.api.dto.ErrorEnvelope;
import errorapp.api.exception.ApiError;
import errorapp.api.exception.BusinessError;
import errorapp.api.exception.InfrastructureError;
import errorapp.api.exception.UnclassifiedError;
import errorapp.logging.ErrorEvent;
import errorapp.logging.ErrorEventSink;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Translates an {@link ApiError} into an HTTP response and at most one log record.
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>{@code BUSINESS}: the error's own status, {@code msg} is its payload, nothing logged</li>
 *   <li>{@code INFRASTRUCTURE}: 503 with a fixed message; service, detail and path are logged</li>
 *   <li>{@code UNCLASSIFIED}: 500 with a fixed message; the error description and path are logged</li>
 * </ul>
 *
 * <p>Infrastructure detail and unclassified descriptions only ever reach the
 * {@link ErrorEventSink}; they are never part of the response body.
 */
@Component
public class ApiErrorResponder {

    static final String INFRASTRUCTURE_EVENT = "Infrastructure error";
    static final String UNCLASSIFIED_EVENT = "Unknown error";

    private static final ErrorEnvelope SERVICE_UNAVAILABLE = new ErrorEnvelope(
            HttpStatus.SERVICE_UNAVAILABLE.value(), ErrorEnvelope.SERVICE_UNAVAILABLE_MESSAGE);
    private static final ErrorEnvelope INTERNAL_ERROR = new ErrorEnvelope(
            HttpStatus.INTERNAL_SERVER_ERROR.value(), ErrorEnvelope.INTERNAL_ERROR_MESSAGE);

    private final JsonResponseWriter writer;
    private final ErrorEventSink sink;

    public ApiErrorResponder(final JsonResponseWriter writer, final ErrorEventSink sink) {
        this.writer = writer;
        this.sink = sink;
    }

    /**
     * Writes the response for {@code error} and records the matching log event.
     *
     * <p>The log event is recorded even when writing the body fails; the write
     * failure is then rethrown without attempting another write.
     *
     * @param error the classified error
     * @param request the current request, used for the path in log records
     * @param response the response to write
     * @throws IOException if the response body cannot be written
     */
    public void respond(final ApiError error, final HttpServletRequest request,
                        final HttpServletResponse response) throws IOException {
        final String path = request.getRequestURI();

        final ErrorEnvelope envelope = switch (error.kind()) {
            case BUSINESS -> {
                final BusinessError business = (BusinessError) error;
                yield new ErrorEnvelope(business.statusCode(), business.payload());
            }
            case INFRASTRUCTURE -> SERVICE_UNAVAILABLE;
            case UNCLASSIFIED -> INTERNAL_ERROR;
        };

        final ErrorEvent event = switch (error.kind()) {
            case BUSINESS -> null;
            case INFRASTRUCTURE -> infrastructureEvent((InfrastructureError) error, path);
            case UNCLASSIFIED -> unclassifiedEvent((UnclassifiedError) error, path);
        };

        try {
            writer.write(response, envelope.statusCode(), envelope);
        } finally {
            if (event != null) {
                sink.record(event);
            }
        }
    }

    private static ErrorEvent infrastructureEvent(final InfrastructureError error, final String path) {
        final Map<String, String> fields = new LinkedHashMap<>();
        fields.put("service", error.serviceName());
        fields.put("detail", error.detail());
        fields.put("path", path);
        return new ErrorEvent(INFRASTRUCTURE_EVENT, fields, error.getCause());
    }

    private static ErrorEvent unclassifiedEvent(final UnclassifiedError error, final String path) {
        final Map<String, String> fields = new LinkedHashMap<>();
        fields.put("error", error.description());
        fields.put("path", path);
        return new ErrorEvent(UNCLASSIFIED_EVENT, fields, error.getCause());
    }
}
