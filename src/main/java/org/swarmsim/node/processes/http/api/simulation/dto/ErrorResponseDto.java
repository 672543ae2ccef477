package org.swarmsim.node.processes.http.api.simulation.dto;

import java.time.Instant;

/**
 * Body of every error response of the REST API.
 *
 * @param timestamp ISO-8601 time the error occurred
 * @param status    HTTP status code
 * @param error     HTTP status message, e.g. "Not Found"
 * @param message   Human-readable description
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
