package com.taskline.core.error;

import java.util.Map;

/**
 * Unexpected failure of a task operation, typically a store write that failed.
 * Writes are never retried, so the caller sees the failure with the code of
 * the operation that was attempted.
 */
public class TaskOperationException extends TasklineException {

    public TaskOperationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, Map.of(), cause);
    }
}
