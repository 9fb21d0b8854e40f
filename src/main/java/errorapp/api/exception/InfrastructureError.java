package errorapp.api.exception;

/**
 * Failure of a dependency the caller cannot see (database, cache, remote service).
 *
 * <p>The detail is one-way: it is written to the server log and never serialized
 * into a response. Clients only receive a generic 503 envelope.
 */
public final class InfrastructureError extends ApiError {

    private static final long serialVersionUID = 1L;

    private final String serviceName;
    private final String detail;

    public InfrastructureError(final String serviceName, final String detail) {
        this(serviceName, detail, null);
    }

    /**
     * Creates an infrastructure error.
     *
     * @param serviceName name of the failing dependency
     * @param detail diagnostic text for the log
     * @param cause underlying failure, may be null
     * @throws IllegalArgumentException if serviceName is blank
     */
    public InfrastructureError(final String serviceName, final String detail, final Throwable cause) {
        super(ErrorKind.INFRASTRUCTURE,
                "infrastructure error with service " + serviceName + ": " + detail,
                cause);
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.serviceName = serviceName;
        this.detail = detail == null ? "" : detail;
    }

    public String serviceName() {
        return serviceName;
    }

    public String detail() {
        return detail;
    }
}
