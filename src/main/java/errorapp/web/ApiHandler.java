package errorapp.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * A request handler that reports failure by throwing instead of writing an error response.
 *
 * <p>On success the handler has written the complete response. On failure it throws
 * (typically a {@link errorapp.api.exception.BusinessError} or
 * {@link errorapp.api.exception.InfrastructureError}) before writing anything;
 * {@link ApiHandlerAdapter} turns the failure into the response.
 */
@FunctionalInterface
public interface ApiHandler {

    void handle(HttpServletRequest request, HttpServletResponse response) throws Exception;
}
