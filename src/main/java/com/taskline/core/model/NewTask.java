package com.taskline.core.model;

/**
 * Validated input for creating a task. Nullable components fall back to the
 * task defaults (priority MEDIUM, no agent, no trust data).
 */
public record NewTask(
    String title,
    String description,
    TaskPriority priority,
    String agentId,
    Double confidenceScore,
    StepLog reasoningLog,
    StepLog executionSteps,
    Boolean requiresReview
) {

    public static NewTask titled(String title) {
        return new NewTask(title, null, null, null, null, null, null, null);
    }
}
