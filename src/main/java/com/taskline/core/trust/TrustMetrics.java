package com.taskline.core.trust;

/**
 * Calibration signals computed over all of a user's tasks.
 *
 * @param totalHighConfidenceTasks      tasks with confidence at or above 0.7
 * @param overriddenHighConfidenceTasks of those, tasks a reviewer overrode
 * @param falseConfidenceRate           overridden / high-confidence, 0 when there are none
 * @param totalRetries                  sum of retry counts over retried tasks
 * @param averageRetryVelocityMs        mean time from first attempt to completion of retried DONE tasks, nullable
 * @param tasksRequiringReview          tasks currently flagged for review
 * @param tasksReviewed                 tasks with a review timestamp
 * @param reviewRate                    reviewed / requiring review, 0 when none require review
 * @param averageConfidence             mean of the non-null confidence scores, nullable
 */
public record TrustMetrics(
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
