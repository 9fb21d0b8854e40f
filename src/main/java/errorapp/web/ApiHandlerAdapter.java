package errorapp.web;

import errorapp.api.exception.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.HttpRequestHandler;

/**
 * Adapts an {@link ApiHandler} to Spring's {@link HttpRequestHandler}.
 *
 * <p>When the wrapped handler completes normally nothing else happens. When it throws,
 * the failure is classified with {@link ApiError#classify(Throwable)} and passed to
 * {@link ApiErrorResponder} exactly once. {@link Error}s are left to the container.
 *
 * <h2>Precondition</h2>
 * <p>A handler must either succeed or fail before writing any output. If it fails after
 * the response has been committed, the responder is still called; the servlet container
 * then ignores the second status line and a warning is logged.
 */
@Component
public class ApiHandlerAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(ApiHandlerAdapter.class);

    private final ApiErrorResponder responder;

    public ApiHandlerAdapter(final ApiErrorResponder responder) {
        this.responder = responder;
    }

    /**
     * Wraps {@code handler} so that every failure becomes an error response.
     *
     * @param handler the fallible handler
     * @return a handler that never propagates the wrapped handler's exceptions
     */
    public HttpRequestHandler adapt(final ApiHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        return (request, response) -> {
            try {
                handler.handle(request, response);
            } catch (Exception ex) {
                if (ex instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                handleFailure(ApiError.classify(ex), request, response);
            }
        };
    }

    private void handleFailure(final ApiError error, final HttpServletRequest request,
                               final HttpServletResponse response) {
        if (response.isCommitted()) {
            LOG.warn("Handler for {} failed after the response was committed", request.getRequestURI());
        }
        try {
            responder.respond(error, request, response);
        } catch (IOException | RuntimeException ex) {
            LOG.warn("Failed to write error response for {}", request.getRequestURI(), ex);
        }
    }
}
