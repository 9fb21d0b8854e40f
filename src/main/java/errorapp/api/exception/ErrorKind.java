package errorapp.api.exception;

/**
 * Discriminant carried by every {@link ApiError}.
 *
 * <p>The kind is fixed when the error is constructed and is the only thing
 * {@link errorapp.web.ApiErrorResponder} looks at when choosing a response. Only
 * {@link #BUSINESS} errors may expose their content to the caller.
 */
public enum ErrorKind {
    /** Caller-actionable failure, safe to expose. */
    BUSINESS,
    /** A dependency failed; masked from the caller and logged. */
    INFRASTRUCTURE,
    /** Anything else; treated as a server bug, masked and logged. */
    UNCLASSIFIED
}
