package errorapp.web;

import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import tools.jackson.databind.json.JsonMapper;

/**
 * Writes a JSON body with a given status.
 *
 * <p>The status is set first, then the content type, then the body is streamed.
 * Once the body starts the response is committed and headers can no longer change.
 */
@Component
public class JsonResponseWriter {

    private final JsonMapper jsonMapper;

    public JsonResponseWriter(final JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * Sets the status and content type, then serializes {@code value} to the response.
     *
     * @param response the servlet response
     * @param status HTTP status code
     * @param value body to serialize
     * @throws IOException if the output stream cannot be obtained or written
     * @throws tools.jackson.core.JacksonException if {@code value} cannot be serialized
     */
    public void write(final HttpServletResponse response, final int status, final Object value)
            throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        jsonMapper.writeValue(response.getOutputStream(), value);
    }
}
