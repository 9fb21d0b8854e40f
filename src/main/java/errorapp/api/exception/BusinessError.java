package errorapp.api.exception;

import org.springframework.http.HttpStatusCode;

/**
 * A failure the caller caused or can act on, such as invalid input.
 *
 * <p>The status code and payload are sent to the client verbatim inside the
 * {@link errorapp.api.dto.ErrorEnvelope}. The payload may be any value the
 * application {@code JsonMapper} can serialize: a plain message, a map of field
 * names to validation messages, a record.
 */
public final class BusinessError extends ApiError {

    private static final long serialVersionUID = 1L;

    private static final int MIN_STATUS = 100;
    private static final int MAX_STATUS = 599;

    private final int statusCode;
    private final transient Object payload;

    /**
     * Creates a business error.
     *
     * @param statusCode HTTP status to send, usually 4xx
     * @param payload detail safe to expose to the client
     * @throws IllegalArgumentException if the status is outside 100..599 or payload is null
     */
    public BusinessError(final int statusCode, final Object payload) {
        super(ErrorKind.BUSINESS, statusCode + ": " + payload, null);
        if (statusCode < MIN_STATUS || statusCode > MAX_STATUS) {
            throw new IllegalArgumentException("statusCode must be a valid HTTP status: " + statusCode);
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        this.statusCode = statusCode;
        this.payload = payload;
    }

    public BusinessError(final HttpStatusCode status, final Object payload) {
        this(status.value(), payload);
    }

    /**
     * Creates a business error whose payload is the message of another failure.
     *
     * @param statusCode HTTP status to send
     * @param cause failure whose message becomes the payload
     * @return the business error
     */
    public static BusinessError of(final int statusCode, final Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause must not be null");
        }
        final String message = cause.getMessage();
        return new BusinessError(statusCode, message != null ? message : cause.toString());
    }

    public int statusCode() {
        return statusCode;
    }

    public Object payload() {
        return payload;
    }
}
