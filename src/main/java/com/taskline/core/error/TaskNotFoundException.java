package com.taskline.core.error;

import java.util.Map;

/**
 * The task does not exist or is not owned by the caller. The two cases are
 * deliberately indistinguishable to the caller.
 */
public class TaskNotFoundException extends TasklineException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(ErrorCode.TASK_NOT_FOUND, "Task not found", Map.of("taskId", taskId), null);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
