package org.glossa.node.processes.http.api.dto;

import java.time.Instant;

/**
 * Error body returned by every API endpoint.
 *
 * @param timestamp ISO-8601 time the error occurred
 * @param status    HTTP status code
 * @param error     HTTP reason phrase (e.g. "Not Found")
 * @param message   human-readable detail
 */
public record ErrorResponseDto(
    String timestamp,
    int status,
    String error,
    String message
) {
    public static ErrorResponseDto of(final int status, final String error, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
