package com.taskline.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every failure the task engine reports to callers.
 * Carries a stable {@link ErrorCode} and structured details for the error body.
 */
public abstract class TasklineException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    protected TasklineException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    protected TasklineException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }
}
