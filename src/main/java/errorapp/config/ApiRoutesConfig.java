package errorapp.config;

import errorapp.api.DemoHandlers;
import errorapp.web.ApiHandlerAdapter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.handler.SimpleUrlHandlerMapping;

/**
 * Registers the demo routes.
 *
 * <p>Every route is an {@link errorapp.web.ApiHandler} wrapped by {@link ApiHandlerAdapter},
 * so all error responses come from one place. The mapping is ordered ahead of the
 * annotation-based handler mapping.
 */
@Configuration
public class ApiRoutesConfig {

    @Bean
    public SimpleUrlHandlerMapping apiRoutes(final ApiHandlerAdapter adapter, final DemoHandlers handlers) {
        final Map<String, Object> routes = new LinkedHashMap<>();
        routes.put("/hello", adapter.adapt(handlers::hello));
        routes.put("/validationerror", adapter.adapt(handlers::validationError));
        routes.put("/dberror", adapter.adapt(handlers::databaseError));
        routes.put("/cacheerror", adapter.adapt(handlers::cacheError));
        return new SimpleUrlHandlerMapping(routes, Ordered.HIGHEST_PRECEDENCE);
    }
}
