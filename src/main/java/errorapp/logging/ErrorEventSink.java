package errorapp.logging;

/**
 * Destination for server-side error records.
 *
 * <p>Implementations must be safe to call from concurrent request threads.
 */
@FunctionalInterface
public interface ErrorEventSink {

    void record(ErrorEvent event);
}
