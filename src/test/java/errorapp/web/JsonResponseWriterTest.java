package errorapp.web;

import errorapp.api.dto.HelloResponse;
import errorapp.support.TestJsonMappers;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link JsonResponseWriter}.
 */
class JsonResponseWriterTest {

    private JsonResponseWriter writer;

    @BeforeEach
    void setUp() {
        writer = new JsonResponseWriter(TestJsonMappers.applicationMapper());
    }

    @Test
    void writesStatusContentTypeAndBody() throws Exception {
        final MockHttpServletResponse response = new MockHttpServletResponse();

        writer.write(response, 200, new HelloResponse("Hello, World!"));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getContentType()).startsWith(MediaType.APPLICATION_JSON_VALUE);
        assertThat(response.getContentAsString()).isEqualTo("{\"message\":\"Hello, World!\"}");
    }

    @Test
    void setsStatusBeforeContentTypeBeforeBody() throws Exception {
        final HttpServletResponse response = mock(HttpServletResponse.class);
        final ServletOutputStream out = mock(ServletOutputStream.class);
        when(response.getOutputStream()).thenReturn(out);

        writer.write(response, 201, new HelloResponse("created"));

        final InOrder order = inOrder(response);
        order.verify(response).setStatus(201);
        order.verify(response).setContentType(MediaType.APPLICATION_JSON_VALUE);
        order.verify(response).getOutputStream();
    }

    @Test
    void propagatesOutputStreamFailure() throws Exception {
        final HttpServletResponse response = mock(HttpServletResponse.class);
        when(response.getOutputStream()).thenThrow(new IOException("client went away"));

        assertThatThrownBy(() -> writer.write(response, 200, new HelloResponse("hi")))
                .isInstanceOf(IOException.class)
                .hasMessage("client went away");
    }

    @Test
    void propagatesSerializationFailure() {
        final MockHttpServletResponse response = new MockHttpServletResponse();

        assertThatThrownBy(() -> writer.write(response, 200, new Unserializable()))
                .isInstanceOf(RuntimeException.class)
                .hasStackTraceContaining("value unavailable");
        assertThat(response.getStatus()).isEqualTo(200);
    }

    public static final class Unserializable {
        public String getValue() {
            throw new IllegalStateException("value unavailable");
        }
    }
}
