package errorapp.api.dto;

/**
 * Body of the {@code /hello} route.
 *
 * @param message greeting text
 */
public record HelloResponse(String message) {
}
