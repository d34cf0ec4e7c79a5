package com.taskline.core.store;

import com.taskline.core.model.Task;
import com.taskline.core.model.TaskFilter;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link TaskStore}. Suitable for development and tests; state
 * is lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Comparator<Task> NEWEST_FIRST =
            Comparator.comparing(Task::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(Task::id);

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public Optional<Task> get(String taskId, String ownerId) {
        Task task = tasks.get(taskId);
        if (task == null || !task.ownerId().equals(ownerId)) {
            return Optional.empty();
        }
        return Optional.of(task);
    }

    @Override
    public Task save(Task task) {
        Task refreshed = task.touchedAt(clock.instant());
        tasks.put(refreshed.id(), refreshed);
        return refreshed;
    }

    @Override
    public boolean delete(String taskId, String ownerId) {
        Task existing = tasks.get(taskId);
        if (existing == null || !existing.ownerId().equals(ownerId)) {
            return false;
        }
        return tasks.remove(taskId, existing);
    }

    @Override
    public List<Task> listByOwner(String ownerId, TaskFilter filter) {
        TaskFilter criteria = filter == null ? TaskFilter.none() : filter;
        return tasks.values().stream()
                .filter(t -> t.ownerId().equals(ownerId))
                .filter(criteria::matches)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public int size() {
        return tasks.size();
    }
}
