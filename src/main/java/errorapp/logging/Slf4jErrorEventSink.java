package errorapp.logging;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;
import org.springframework.stereotype.Component;

/**
 * Writes {@link ErrorEvent}s at error level through SLF4J.
 *
 * <p>Each event field becomes an SLF4J key/value pair, rendered by the
 * {@code %kvp} conversion configured in {@code application.yml}.
 */
@Component
public class Slf4jErrorEventSink implements ErrorEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(Slf4jErrorEventSink.class);

    @Override
    public void record(final ErrorEvent event) {
        LoggingEventBuilder builder = LOG.atError().setMessage(event.message());
        for (Map.Entry<String, String> field : event.fields().entrySet()) {
            builder = builder.addKeyValue(field.getKey(), field.getValue());
        }
        if (event.cause() != null) {
            builder = builder.setCause(event.cause());
        }
        builder.log();
    }
}
