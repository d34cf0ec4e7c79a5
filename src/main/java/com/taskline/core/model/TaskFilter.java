package com.taskline.core.model;

/**
 * Optional criteria for listing a user's tasks; {@code null} components match anything.
 */
public record TaskFilter(
    TaskStatus status,
    TaskPriority priority,
    String agentId,
    Boolean requiresReview
) {

    private static final TaskFilter NONE = new TaskFilter(null, null, null, null);

    public static TaskFilter none() {
        return NONE;
    }

    public boolean matches(Task task) {
        return (status == null || status == task.status())
                && (priority == null || priority == task.priority())
                && (agentId == null || agentId.equals(task.agentId()))
                && (requiresReview == null || requiresReview == task.requiresReview());
    }
}
