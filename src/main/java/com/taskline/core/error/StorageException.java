package com.taskline.core.error;

import java.util.Map;

/**
 * Failure of the task store collaborator. Idempotent reads are retried once
 * before this reaches the caller as {@link ErrorCode#FETCH_ERROR}.
 */
public class StorageException extends TasklineException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.FETCH_ERROR, message, Map.of(), cause);
    }
}
