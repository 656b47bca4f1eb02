package com.example.workoutlog.interfaces.api.error;

import java.time.Instant;

/**
 * JSON body returned for every failed API call.
 *
 * @param timestamp when the failure was handled
 * @param status    HTTP status code
 * @param error     stable code such as {@code DOMAIN_ERROR}
 * @param message   explanation for the client
 * @param path      request URI
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
