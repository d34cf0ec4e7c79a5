package com.taskline.core.events;

import com.taskline.core.model.Task;

import java.time.Instant;

/**
 * An ephemeral notification that a task was created, updated or deleted.
 * Used only for live delivery; never persisted or replayed.
 *
 * @param type      what happened
 * @param taskId    the task concerned
 * @param ownerId   the user whose subscribers receive the event
 * @param task      full snapshot after the mutation; {@code null} for deletions
 * @param timestamp when the mutation committed
 */
public record TaskEvent(
    TaskEventType type,
    String taskId,
    String ownerId,
    Task task,
    Instant timestamp
) {

    public static TaskEvent created(Task task, Instant timestamp) {
        return new TaskEvent(TaskEventType.CREATED, task.id(), task.ownerId(), task, timestamp);
    }

    public static TaskEvent updated(Task task, Instant timestamp) {
        return new TaskEvent(TaskEventType.UPDATED, task.id(), task.ownerId(), task, timestamp);
    }

    public static TaskEvent deleted(String taskId, String ownerId, Instant timestamp) {
        return new TaskEvent(TaskEventType.DELETED, taskId, ownerId, null, timestamp);
    }
}
