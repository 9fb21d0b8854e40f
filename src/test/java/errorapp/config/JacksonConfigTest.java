package errorapp.config;

import errorapp.api.dto.ErrorEnvelope;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.jackson.autoconfigure.JsonMapperBuilderCustomizer;
import tools.jackson.databind.json.JsonMapper;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Ensures {@link JacksonConfig} makes map payloads serialize in key order.
 */
class JacksonConfigTest {

    private JsonMapper mapper;

    @BeforeEach
    void setUp() {
        JacksonConfig config = new JacksonConfig();
        JsonMapperBuilderCustomizer customizer = config.sortedMapEntriesCustomizer();
        JsonMapper.Builder builder = JsonMapper.builder();
        customizer.customize(builder);
        mapper = builder.build();
    }

    @Test
    void jsonMapperIsConfigured() {
        assertThat(mapper).isNotNull();
    }

    @Test
    void mapEntriesAreWrittenInKeyOrder() {
        Map<String, String> errors = new LinkedHashMap<>();
        errors.put("username", "username is required");
        errors.put("email", "email is invalid");

        assertThat(mapper.writeValueAsString(errors))
                .isEqualTo("{\"email\":\"email is invalid\",\"username\":\"username is required\"}");
    }

    @Test
    void envelopeKeepsStatusCodeBeforeMsg() {
        String json = mapper.writeValueAsString(new ErrorEnvelope(500, "internal server error"));

        assertThat(json).isEqualTo("{\"statusCode\":500,\"msg\":\"internal server error\"}");
    }
}
