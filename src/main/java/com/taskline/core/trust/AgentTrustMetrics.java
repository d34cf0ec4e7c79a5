package com.taskline.core.trust;

/**
 * {@link TrustMetrics} restricted to one agent's tasks, plus completion counts.
 * {@code failedTasks} counts CANCELLED tasks, since there is no failed status.
 */
public record AgentTrustMetrics(
    String agentId,
    int totalTasks,
    int completedTasks,
    int failedTasks,
    int totalHighConfidenceTasks,
    int overriddenHighConfidenceTasks,
    double falseConfidenceRate,
    int totalRetries,
    Double averageRetryVelocityMs,
    int tasksRequiringReview,
    int tasksReviewed,
    double reviewRate,
    Double averageConfidence
) {}
