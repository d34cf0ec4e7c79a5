package com.taskline.core.store;

import com.taskline.core.model.Task;
import com.taskline.core.model.TaskFilter;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for tasks. Every lookup is scoped to the owning user; a task
 * owned by someone else behaves exactly like a missing one.
 * <p>
 * Implementations report collaborator failures as
 * {@link com.taskline.core.error.StorageException}.
 */
public interface TaskStore {

    Optional<Task> get(String taskId, String ownerId);

    /**
     * Inserts or replaces the task.
     *
     * @return the stored task with a refreshed {@code updatedAt}
     */
    Task save(Task task);

    /**
     * @return {@code false} when no task with that id is owned by {@code ownerId}
     */
    boolean delete(String taskId, String ownerId);

    /**
     * Tasks owned by {@code ownerId} matching {@code filter}, newest first.
     */
    List<Task> listByOwner(String ownerId, TaskFilter filter);

    /**
     * Cheap reachability probe used by health checks.
     */
    default boolean isAvailable() {
        return true;
    }
}
