package tech.syncbridge.platform.shared;

import java.util.List;

/**
 * Error body returned by the exception mappers.
 *
 * @param details individual validation failures, empty when the error has a single cause
 */
public record ErrorResponse(
    String error,
    List<String> details
) {
    public ErrorResponse(String error) {
        this(error, List.of());
    }
}
