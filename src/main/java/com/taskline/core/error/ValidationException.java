package com.taskline.core.error;

import java.util.List;
import java.util.Map;

/**
 * Malformed request input, rejected before it reaches the state machine.
 */
public class ValidationException extends TasklineException {

    private final List<String> issues;

    public ValidationException(List<String> issues) {
        super(ErrorCode.VALIDATION_ERROR, "Validation failed", Map.of("issues", List.copyOf(issues)), null);
        this.issues = List.copyOf(issues);
    }

    public ValidationException(String issue) {
        this(List.of(issue));
    }

    public List<String> issues() {
        return issues;
    }
}
