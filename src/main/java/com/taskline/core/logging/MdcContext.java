package com.taskline.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setUser(String userId) {
        MDC.put("userId", userId);
    }

    public static void setTask(String userId, String taskId) {
        MDC.put("userId", userId);
        MDC.put("taskId", taskId);
    }

    public static void setOperation(String userId, String taskId, String operation) {
        setTask(userId, taskId);
        MDC.put("operation", operation);
    }

    /** Removes the task and operation keys, keeping the user set by the request filter. */
    public static void clearOperation() {
        MDC.remove("taskId");
        MDC.remove("operation");
    }

    public static void clear() {
        MDC.remove("userId");
        MDC.remove("taskId");
        MDC.remove("operation");
    }
}
