package com.taskline.core.events;

/**
 * Kind of task lifecycle event, with the name clients see on the stream.
 */
public enum TaskEventType {
    CREATED("TASK_CREATED"),
    UPDATED("TASK_UPDATED"),
    DELETED("TASK_DELETED");

    private final String wireName;

    TaskEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
