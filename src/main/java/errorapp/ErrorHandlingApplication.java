package errorapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point. Starts the embedded server on the port from {@code application.yml};
 * startup fails and the process exits if the port cannot be bound.
 */
@SpringBootApplication
public class ErrorHandlingApplication {

    public static void main(final String[] args) {
        SpringApplication.run(ErrorHandlingApplication.class, args);
    }
}
