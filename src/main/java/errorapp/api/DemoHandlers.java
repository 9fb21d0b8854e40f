package errorapp.api;

import errorapp.api.dto.HelloResponse;
import errorapp.api.exception.BusinessError;
import errorapp.api.exception.InfrastructureError;
import errorapp.web.JsonResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Example {@link errorapp.web.ApiHandler}s, one per demo route.
 *
 * <ul>
 *   <li>{@code /hello}: writes a 200 greeting</li>
 *   <li>{@code /validationerror}: fails with a 422 {@link BusinessError} carrying field messages</li>
 *   <li>{@code /dberror}, {@code /cacheerror}: fail with an {@link InfrastructureError}</li>
 * </ul>
 *
 * @see errorapp.config.ApiRoutesConfig
 */
@Component
public class DemoHandlers {

    static final String GREETING = "Hello, World!";

    private final JsonResponseWriter writer;

    public DemoHandlers(final JsonResponseWriter writer) {
        this.writer = writer;
    }

    public void hello(final HttpServletRequest request, final HttpServletResponse response)
            throws IOException {
        writer.write(response, HttpStatus.OK.value(), new HelloResponse(GREETING));
    }

    public void validationError(final HttpServletRequest request, final HttpServletResponse response) {
        final Map<String, String> errors = new LinkedHashMap<>();
        errors.put("username", "username is required");
        errors.put("email", "email is invalid");
        throw new BusinessError(HttpStatus.UNPROCESSABLE_ENTITY, errors);
    }

    public void databaseError(final HttpServletRequest request, final HttpServletResponse response) {
        throw new InfrastructureError("Database", "failed to connect to database");
    }

    public void cacheError(final HttpServletRequest request, final HttpServletResponse response) {
        throw new InfrastructureError("Cache", "failed to connect to Redis");
    }
}
