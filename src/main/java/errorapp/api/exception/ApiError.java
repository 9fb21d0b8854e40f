package errorapp.api.exception;

import java.util.Objects;

/**
 * Base type for every failure an {@link errorapp.web.ApiHandler} can report.
 *
 * <p>The hierarchy is closed: an error is a {@link BusinessError}, an
 * {@link InfrastructureError} or an {@link UnclassifiedError}, and each subclass
 * passes its own {@link ErrorKind} to this constructor. Callers dispatch on
 * {@link #kind()} rather than on the runtime shape of the error, so an
 * infrastructure failure can never be mistaken for something safe to show.
 *
 * @see errorapp.web.ApiErrorResponder
 */
public abstract sealed class ApiError extends RuntimeException
        permits BusinessError, InfrastructureError, UnclassifiedError {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    ApiError(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the discriminant fixed at construction.
     *
     * @return the error kind, never null
     */
    public final ErrorKind kind() {
        return kind;
    }

    /**
     * Maps an arbitrary failure onto the closed error hierarchy.
     *
     * <p>An {@code ApiError} is returned unchanged; any other throwable is wrapped
     * in an {@link UnclassifiedError}.
     *
     * @param failure the failure raised by a handler
     * @return the classified error
     * @throws IllegalArgumentException if failure is null
     */
    public static ApiError classify(final Throwable failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        if (failure instanceof ApiError apiError) {
            return apiError;
        }
        return new UnclassifiedError(failure);
    }
}
