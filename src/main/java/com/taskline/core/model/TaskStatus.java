package com.taskline.core.model;

/**
 * Workflow status of a task. Legal moves between statuses are defined by
 * {@link com.taskline.core.lifecycle.StatusTransitions}.
 */
public enum TaskStatus {
    TODO,
    IN_PROGRESS,
    REVIEW,
    DONE,
    CANCELLED
}
