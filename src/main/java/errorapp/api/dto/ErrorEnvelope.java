package errorapp.api.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Wire format for every error response: {@code {"statusCode": 422, "msg": ...}}.
 *
 * <p>For business errors {@code msg} is the payload supplied by the handler. For
 * infrastructure and unclassified errors it is one of the fixed messages below.
 *
 * @param statusCode HTTP status echoed in the body
 * @param msg message or structured detail
 */
@JsonPropertyOrder({"statusCode", "msg"})
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Payload is handed straight to the JSON serializer")
public record ErrorEnvelope(int statusCode, Object msg) {

    public static final String SERVICE_UNAVAILABLE_MESSAGE = "service temporarily unavailable";
    public static final String INTERNAL_ERROR_MESSAGE = "internal server error";
}
