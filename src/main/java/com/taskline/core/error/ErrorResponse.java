package com.taskline.core.error;

import java.time.Instant;
import java.util.Map;

/**
 * Body of every error response: {@code {error, code, details, timestamp}}.
 */
public record ErrorResponse(
    String error,
    String code,
    Map<String, Object> details,
    Instant timestamp
) {

    public static ErrorResponse of(TasklineException e, Instant timestamp) {
        return new ErrorResponse(e.getMessage(), e.code().name(), e.details(), timestamp);
    }

    public static ErrorResponse of(ErrorCode code, String message, Instant timestamp) {
        return new ErrorResponse(message, code.name(), Map.of(), timestamp);
    }
}
