package errorapp.config;

import org.springframework.boot.jackson.autoconfigure.JsonMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Jackson configuration for deterministic response bodies.
 *
 * <p>Map payloads (for example field validation messages) are written with their
 * entries sorted by key, so {@code {"username": ..., "email": ...}} always serializes as
 * {@code {"email": ..., "username": ...}} regardless of the map implementation.
 */
@Configuration
public class JacksonConfig {

    /**
     * Customizes the Jackson 3 JsonMapper to order map entries by key.
     *
     * @return customizer for the JsonMapper builder
     */
    @Bean
    public JsonMapperBuilderCustomizer sortedMapEntriesCustomizer() {
        return builder -> configureMapOrdering(builder);
    }

    private void configureMapOrdering(final JsonMapper.Builder builder) {
        builder.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }
}
