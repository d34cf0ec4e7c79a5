package com.taskline.core.lifecycle;

import com.taskline.core.error.ErrorCode;
import com.taskline.core.error.StorageException;
import com.taskline.core.error.TaskNotFoundException;
import com.taskline.core.error.TaskOperationException;
import com.taskline.core.error.TasklineException;
import com.taskline.core.events.EventBroadcaster;
import com.taskline.core.events.TaskEvent;
import com.taskline.core.logging.MdcContext;
import com.taskline.core.metrics.TasklineMetrics;
import com.taskline.core.model.NewTask;
import com.taskline.core.model.Task;
import com.taskline.core.model.TaskFilter;
import com.taskline.core.model.TaskPatch;
import com.taskline.core.model.TaskPriority;
import com.taskline.core.model.TaskStatus;
import com.taskline.core.store.StoreReads;
import com.taskline.core.store.TaskStore;
import com.taskline.core.trust.TrustPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * The only component that mutates tasks.
 * <p>
 * Each mutation reads the task, applies the lifecycle rules, writes it back
 * and publishes one event, all while holding that task's lock. Mutations of
 * different tasks run in parallel. Reads are retried once on a storage
 * failure; writes are not retried.
 */
@Service
public class TaskStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);

    private final TaskStore store;
    private final EventBroadcaster broadcaster;
    private final StoreReads reads;
    private final TasklineMetrics metrics;
    private final Clock clock;
    private final TaskLocks locks = new TaskLocks();

    public TaskStateMachine(TaskStore store,
                            EventBroadcaster broadcaster,
                            StoreReads reads,
                            TasklineMetrics metrics,
                            Clock clock) {
        this.store = store;
        this.broadcaster = broadcaster;
        this.reads = reads;
        this.metrics = metrics;
        this.clock = clock;
    }

    // --- Reads ---

    public Task get(String ownerId, String taskId) {
        return reads.read("get", () -> store.get(taskId, ownerId))
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public List<Task> list(String ownerId, TaskFilter filter) {
        TaskFilter criteria = filter != null ? filter : TaskFilter.none();
        return reads.read("listByOwner", () -> store.listByOwner(ownerId, criteria));
    }

    /**
     * Task counts per status for one user. Every status is present, with zero
     * when the user has no task in it.
     */
    public Map<TaskStatus, Long> countByStatus(String ownerId) {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        for (Task task : list(ownerId, TaskFilter.none())) {
            counts.merge(task.status(), 1L, Long::sum);
        }
        return counts;
    }

    // --- Mutations ---

    public Task create(String ownerId, NewTask input) {
        String taskId = UUID.randomUUID().toString();
        return instrumented(ownerId, taskId, "create", () -> locks.withLock(taskId, () -> {
            Instant now = clock.instant();
            boolean flagged = Boolean.TRUE.equals(input.requiresReview())
                    || TrustPolicy.shouldRequireReview(input.confidenceScore());
            Task task = Task.builder()
                    .id(taskId)
                    .ownerId(ownerId)
                    .agentId(input.agentId())
                    .title(input.title())
                    .description(input.description())
                    .status(TaskStatus.TODO)
                    .priority(input.priority() != null ? input.priority() : TaskPriority.MEDIUM)
                    .confidenceScore(input.confidenceScore())
                    .reasoningLog(input.reasoningLog())
                    .executionSteps(input.executionSteps())
                    .requiresReview(flagged)
                    .retryCount(0)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            Task saved = write(ErrorCode.CREATE_ERROR, "create", () -> store.save(task));
            log.info("Created task {} (priority={}, agent={}, requiresReview={})",
                    taskId, saved.priority(), saved.agentId(), saved.requiresReview());
            publish(TaskEvent.created(saved, saved.updatedAt()));
            return saved;
        }));
    }

    /**
     * Applies a partial update. A status change is checked against
     * {@link StatusTransitions} before anything else. Setting a confidence score
     * below the review threshold forces {@code requiresReview}, and while the
     * confidence is below it only a review clears the flag. A task flagged again
     * after a review loses its reviewer and review time. The review and
     * retry flags are applied afterwards in that order, so a retry's forced
     * status wins.
     */
    public Task update(String ownerId, String taskId, TaskPatch patch) {
        return mutate(ownerId, taskId, "update", current -> {
            Instant now = clock.instant();
            Task.Builder next = current.toBuilder();

            if (patch.status() != null && patch.status() != current.status()) {
                try {
                    StatusTransitions.check(current.status(), patch.status());
                } catch (TasklineException e) {
                    metrics.recordRejectedTransition(current.status().name(), patch.status().name());
                    throw e;
                }
                next.status(patch.status());
                metrics.recordTransition(current.status().name(), patch.status().name());
                log.info("Task {} {} -> {}", taskId, current.status(), patch.status());
            }

            if (patch.title() != null) next.title(patch.title());
            if (patch.description() != null) next.description(patch.description());
            if (patch.priority() != null) next.priority(patch.priority());
            if (patch.agentId() != null) next.agentId(patch.agentId());
            if (patch.reasoningLog() != null) next.reasoningLog(patch.reasoningLog());
            if (patch.executionSteps() != null) next.executionSteps(patch.executionSteps());
            if (patch.reviewNotes() != null) next.reviewNotes(patch.reviewNotes());
            if (patch.wasOverridden() != null) next.wasOverridden(patch.wasOverridden());
            if (patch.errorMessage() != null) next.errorMessage(patch.errorMessage());
            if (patch.errorCode() != null) next.errorCode(patch.errorCode());
            if (patch.confidenceScore() != null) next.confidenceScore(patch.confidenceScore());

            Double confidence = patch.confidenceScore() != null
                    ? patch.confidenceScore() : current.confidenceScore();
            boolean flagged = current.requiresReview();
            if (patch.requiresReview() != null) {
                if (!patch.requiresReview() && TrustPolicy.shouldRequireReview(confidence)) {
                    // only a review clears the flag of a low-confidence task
                    log.debug("Task {}: ignoring requiresReview=false for confidence {}", taskId, confidence);
                } else {
                    flagged = patch.requiresReview();
                }
            }
            if (TrustPolicy.shouldRequireReview(patch.confidenceScore())) {
                flagged = true;
            }
            next.requiresReview(flagged);
            if (flagged && current.reviewedAt() != null) {
                // flagged again after a review: the old review no longer applies
                log.info("Task {} flagged for review again, clearing review by {}", taskId, current.reviewedById());
                next.reviewedAt(null).reviewedById(null);
            }

            Task updated = next.build();
            if (patch.markAsReviewed()) {
                updated = reviewed(updated, ownerId, patch.reviewNotes(), now);
            }
            if (patch.retry()) {
                updated = retried(updated, now);
            }
            return updated;
        });
    }

    /**
     * Records a human review. The status is left as it is.
     */
    public Task markReviewed(String ownerId, String taskId, String reviewerId, String notes) {
        return mutate(ownerId, taskId, "markReviewed",
                current -> reviewed(current, reviewerId, notes, clock.instant()));
    }

    /**
     * Records that a reviewer overrode the agent's result: a review that also
     * sets {@code wasOverridden}, which feeds the false confidence rate.
     */
    public Task recordOverride(String ownerId, String taskId, String reviewerId, String notes) {
        return mutate(ownerId, taskId, "recordOverride", current -> {
            log.info("Task {} overridden by {} (confidence={})", taskId, reviewerId, current.confidenceScore());
            return reviewed(current, reviewerId, notes, clock.instant()).toBuilder()
                    .wasOverridden(true)
                    .build();
        });
    }

    /**
     * Puts the task back to IN_PROGRESS for another attempt, from any status.
     * This deliberately does not consult {@link StatusTransitions}.
     */
    public Task retry(String ownerId, String taskId) {
        return mutate(ownerId, taskId, "retry", current -> retried(current, clock.instant()));
    }

    public void delete(String ownerId, String taskId) {
        instrumented(ownerId, taskId, "delete", () -> locks.withLock(taskId, () -> {
            boolean removed = write(ErrorCode.DELETE_ERROR, "delete", () -> store.delete(taskId, ownerId));
            if (!removed) {
                throw new TaskNotFoundException(taskId);
            }
            log.info("Deleted task {}", taskId);
            publish(TaskEvent.deleted(taskId, ownerId, clock.instant()));
            return null;
        }));
    }

    // --- Internals ---

    private Task reviewed(Task task, String reviewerId, String notes, Instant now) {
        Task.Builder next = task.toBuilder()
                .reviewedAt(now)
                .reviewedById(reviewerId)
                .requiresReview(false);
        if (notes != null) {
            next.reviewNotes(notes);
        }
        return next.build();
    }

    private Task retried(Task task, Instant now) {
        TaskStatus from = task.status();
        if (!StatusTransitions.isAllowed(from, TaskStatus.IN_PROGRESS) && from != TaskStatus.IN_PROGRESS) {
            log.info("Retry of task {} bypasses transition table: {} -> {}", task.id(), from, TaskStatus.IN_PROGRESS);
        }
        metrics.recordRetry(from.name());
        return task.toBuilder()
                .retryCount(task.retryCount() + 1)
                .firstAttemptAt(task.firstAttemptAt() != null ? task.firstAttemptAt() : now)
                .lastRetryAt(now)
                .errorMessage(null)
                .errorCode(null)
                .status(TaskStatus.IN_PROGRESS)
                .build();
    }

    private Task mutate(String ownerId, String taskId, String operation, UnaryOperator<Task> change) {
        return instrumented(ownerId, taskId, operation, () -> locks.withLock(taskId, () -> {
            Task current = get(ownerId, taskId);
            Task changed = change.apply(current);
            Task saved = write(ErrorCode.UPDATE_ERROR, operation, () -> store.save(changed));
            publish(TaskEvent.updated(saved, saved.updatedAt()));
            return saved;
        }));
    }

    private <T> T write(ErrorCode code, String operation, Supplier<T> write) {
        try {
            return write.get();
        } catch (StorageException e) {
            throw new TaskOperationException(code, "Failed to " + operation + " task", e);
        }
    }

    private void publish(TaskEvent event) {
        try {
            broadcaster.publish(event.ownerId(), event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for task {}: {}", event.type(), event.taskId(), e.getMessage(), e);
        }
    }

    private <T> T instrumented(String ownerId, String taskId, String operation, Supplier<T> body) {
        MdcContext.setOperation(ownerId, taskId, operation);
        long start = System.currentTimeMillis();
        String outcome = "success";
        try {
            return body.get();
        } catch (TasklineException e) {
            outcome = e.code().name();
            throw e;
        } catch (RuntimeException e) {
            outcome = ErrorCode.INTERNAL_ERROR.name();
            throw e;
        } finally {
            metrics.recordMutation(operation, outcome, System.currentTimeMillis() - start);
            MdcContext.clearOperation();
        }
    }
}
