package com.taskline.core.model;

/**
 * Partial update of a task. A {@code null} component means the field was not
 * part of the request and keeps its stored value.
 * <p>
 * {@code markAsReviewed} and {@code retry} are action flags rather than fields:
 * when true, the review or retry action is applied as part of the same mutation.
 */
public record TaskPatch(
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,
    String agentId,
    Double confidenceScore,
    StepLog reasoningLog,
    StepLog executionSteps,
    Boolean requiresReview,
    String reviewNotes,
    Boolean wasOverridden,
    String errorMessage,
    String errorCode,
    boolean markAsReviewed,
    boolean retry
) {

    private static final TaskPatch EMPTY = builder().build();

    public static TaskPatch empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private String description;
        private TaskStatus status;
        private TaskPriority priority;
        private String agentId;
        private Double confidenceScore;
        private StepLog reasoningLog;
        private StepLog executionSteps;
        private Boolean requiresReview;
        private String reviewNotes;
        private Boolean wasOverridden;
        private String errorMessage;
        private String errorCode;
        private boolean markAsReviewed;
        private boolean retry;

        private Builder() {}

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder status(TaskStatus status) { this.status = status; return this; }
        public Builder priority(TaskPriority priority) { this.priority = priority; return this; }
        public Builder agentId(String agentId) { this.agentId = agentId; return this; }
        public Builder confidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; return this; }
        public Builder reasoningLog(StepLog reasoningLog) { this.reasoningLog = reasoningLog; return this; }
        public Builder executionSteps(StepLog executionSteps) { this.executionSteps = executionSteps; return this; }
        public Builder requiresReview(Boolean requiresReview) { this.requiresReview = requiresReview; return this; }
        public Builder reviewNotes(String reviewNotes) { this.reviewNotes = reviewNotes; return this; }
        public Builder wasOverridden(Boolean wasOverridden) { this.wasOverridden = wasOverridden; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder errorCode(String errorCode) { this.errorCode = errorCode; return this; }
        public Builder markAsReviewed(boolean markAsReviewed) { this.markAsReviewed = markAsReviewed; return this; }
        public Builder retry(boolean retry) { this.retry = retry; return this; }

        public TaskPatch build() {
            return new TaskPatch(title, description, status, priority, agentId, confidenceScore,
                    reasoningLog, executionSteps, requiresReview, reviewNotes, wasOverridden,
                    errorMessage, errorCode, markAsReviewed, retry);
        }
    }
}
