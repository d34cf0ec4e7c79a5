package com.taskline.core.error;

import com.taskline.core.model.TaskStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A status change that is not an edge of the transition table. The current
 * status, the attempted status and the legal targets are all reported back to
 * the caller.
 */
public class InvalidStatusTransitionException extends TasklineException {

    private final TaskStatus currentStatus;
    private final TaskStatus attemptedStatus;
    private final List<TaskStatus> validTransitions;

    public InvalidStatusTransitionException(TaskStatus currentStatus,
                                            TaskStatus attemptedStatus,
                                            List<TaskStatus> validTransitions) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                "Cannot transition from " + currentStatus + " to " + attemptedStatus,
                details(currentStatus, attemptedStatus, validTransitions),
                null);
        this.currentStatus = currentStatus;
        this.attemptedStatus = attemptedStatus;
        this.validTransitions = List.copyOf(validTransitions);
    }

    public TaskStatus currentStatus() {
        return currentStatus;
    }

    public TaskStatus attemptedStatus() {
        return attemptedStatus;
    }

    public List<TaskStatus> validTransitions() {
        return validTransitions;
    }

    private static Map<String, Object> details(TaskStatus current, TaskStatus attempted, List<TaskStatus> valid) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentStatus", current.name());
        details.put("attemptedStatus", attempted.name());
        details.put("validTransitions", valid.stream().map(Enum::name).toList());
        return details;
    }
}
