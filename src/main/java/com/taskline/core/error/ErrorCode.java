package com.taskline.core.error;

/**
 * Stable error codes returned to clients. Client UIs switch on these strings,
 * so existing values must never be renamed.
 */
public enum ErrorCode {
    AUTH_REQUIRED(401),
    TASK_NOT_FOUND(404),
    VALIDATION_ERROR(400),
    INVALID_STATUS_TRANSITION(400),
    CREATE_ERROR(500),
    UPDATE_ERROR(500),
    FETCH_ERROR(500),
    DELETE_ERROR(500),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
