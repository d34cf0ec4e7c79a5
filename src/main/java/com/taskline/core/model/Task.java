package com.taskline.core.model;

import java.time.Instant;

/**
 * A unit of work delegated to an autonomous agent, tracked through a fixed
 * status lifecycle together with the trust signals the agent reported.
 *
 * @param id              unique identifier
 * @param ownerId         user who owns the task; every read and write is scoped to it
 * @param agentId         agent the task is assigned to, nullable
 * @param title           short summary
 * @param description     longer free text, nullable
 * @param status          workflow status
 * @param priority        scheduling priority
 * @param confidenceScore agent's self-reported certainty in [0,1], nullable
 * @param reasoningLog    agent reasoning trace, nullable
 * @param executionSteps  agent execution trace, nullable
 * @param requiresReview  whether a human must look at the result
 * @param reviewedAt      when a human reviewed the task, nullable
 * @param reviewedById    who reviewed it, nullable
 * @param reviewNotes     reviewer notes, nullable
 * @param wasOverridden   whether the reviewer overrode the agent's result
 * @param retryCount      number of retries so far
 * @param firstAttemptAt  set at the first retry and never changed afterwards
 * @param lastRetryAt     time of the most recent retry, nullable
 * @param errorMessage    last failure message, nullable
 * @param errorCode       last failure code, nullable
 * @param createdAt       creation time
 * @param updatedAt       last modification time, never moves backwards
 */
public record Task(
    String id,
    String ownerId,
    String agentId,
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,
    Double confidenceScore,
    StepLog reasoningLog,
    StepLog executionSteps,
    boolean requiresReview,
    Instant reviewedAt,
    String reviewedById,
    String reviewNotes,
    boolean wasOverridden,
    int retryCount,
    Instant firstAttemptAt,
    Instant lastRetryAt,
    String errorMessage,
    String errorCode,
    Instant createdAt,
    Instant updatedAt
) {

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Returns a copy whose {@code updatedAt} is {@code now}, or unchanged when
     * {@code now} would move it backwards.
     */
    public Task touchedAt(Instant now) {
        if (updatedAt != null && now.isBefore(updatedAt)) {
            return this;
        }
        return toBuilder().updatedAt(now).build();
    }

    public static final class Builder {
        private String id;
        private String ownerId;
        private String agentId;
        private String title;
        private String description;
        private TaskStatus status = TaskStatus.TODO;
        private TaskPriority priority = TaskPriority.MEDIUM;
        private Double confidenceScore;
        private StepLog reasoningLog;
        private StepLog executionSteps;
        private boolean requiresReview;
        private Instant reviewedAt;
        private String reviewedById;
        private String reviewNotes;
        private boolean wasOverridden;
        private int retryCount;
        private Instant firstAttemptAt;
        private Instant lastRetryAt;
        private String errorMessage;
        private String errorCode;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {}

        private Builder(Task task) {
            this.id = task.id;
            this.ownerId = task.ownerId;
            this.agentId = task.agentId;
            this.title = task.title;
            this.description = task.description;
            this.status = task.status;
            this.priority = task.priority;
            this.confidenceScore = task.confidenceScore;
            this.reasoningLog = task.reasoningLog;
            this.executionSteps = task.executionSteps;
            this.requiresReview = task.requiresReview;
            this.reviewedAt = task.reviewedAt;
            this.reviewedById = task.reviewedById;
            this.reviewNotes = task.reviewNotes;
            this.wasOverridden = task.wasOverridden;
            this.retryCount = task.retryCount;
            this.firstAttemptAt = task.firstAttemptAt;
            this.lastRetryAt = task.lastRetryAt;
            this.errorMessage = task.errorMessage;
            this.errorCode = task.errorCode;
            this.createdAt = task.createdAt;
            this.updatedAt = task.updatedAt;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder ownerId(String ownerId) { this.ownerId = ownerId; return this; }
        public Builder agentId(String agentId) { this.agentId = agentId; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder status(TaskStatus status) { this.status = status; return this; }
        public Builder priority(TaskPriority priority) { this.priority = priority; return this; }
        public Builder confidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; return this; }
        public Builder reasoningLog(StepLog reasoningLog) { this.reasoningLog = reasoningLog; return this; }
        public Builder executionSteps(StepLog executionSteps) { this.executionSteps = executionSteps; return this; }
        public Builder requiresReview(boolean requiresReview) { this.requiresReview = requiresReview; return this; }
        public Builder reviewedAt(Instant reviewedAt) { this.reviewedAt = reviewedAt; return this; }
        public Builder reviewedById(String reviewedById) { this.reviewedById = reviewedById; return this; }
        public Builder reviewNotes(String reviewNotes) { this.reviewNotes = reviewNotes; return this; }
        public Builder wasOverridden(boolean wasOverridden) { this.wasOverridden = wasOverridden; return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder firstAttemptAt(Instant firstAttemptAt) { this.firstAttemptAt = firstAttemptAt; return this; }
        public Builder lastRetryAt(Instant lastRetryAt) { this.lastRetryAt = lastRetryAt; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder errorCode(String errorCode) { this.errorCode = errorCode; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }

        public Task build() {
            return new Task(id, ownerId, agentId, title, description, status, priority,
                    confidenceScore, reasoningLog, executionSteps, requiresReview,
                    reviewedAt, reviewedById, reviewNotes, wasOverridden,
                    retryCount, firstAttemptAt, lastRetryAt, errorMessage, errorCode,
                    createdAt, updatedAt);
        }
    }
}
