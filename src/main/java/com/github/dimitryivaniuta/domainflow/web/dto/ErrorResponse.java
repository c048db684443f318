package com.github.dimitryivaniuta.domainflow.web.dto;

import java.time.Instant;
import java.util.List;

/**
 * Error body of every non-2xx API response.
 *
 * @param code      machine-readable code, e.g. {@code INVALID_CONFIG}
 * @param message   human readable message
 * @param details   field errors for rejected payloads, otherwise empty
 * @param timestamp event time
 */
public record ErrorResponse(String code, String message, List<String> details, Instant timestamp) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, List.of(), Instant.now());
    }
}
