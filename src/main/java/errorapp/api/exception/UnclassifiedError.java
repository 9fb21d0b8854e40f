package errorapp.api.exception;

/**
 * Fallback for any failure that was not raised as a {@link BusinessError} or
 * {@link InfrastructureError}. Produced by {@link ApiError#classify(Throwable)}.
 */
public final class UnclassifiedError extends ApiError {

    private static final long serialVersionUID = 1L;

    private final String description;

    UnclassifiedError(final Throwable cause) {
        super(ErrorKind.UNCLASSIFIED, cause.toString(), cause);
        this.description = cause.toString();
    }

    public String description() {
        return description;
    }
}
