package com.taskline.core.trust;

import com.taskline.core.model.Task;
import com.taskline.core.model.TaskStatus;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes trust calibration metrics from a set of tasks.
 * <p>
 * Stateless and side-effect free: the output depends only on the tasks
 * passed in (and, for {@link #snapshot}, the clock's instant).
 */
public final class TrustMetricsEngine {

    private TrustMetricsEngine() {}

    public static MetricsSnapshot snapshot(Collection<Task> tasks, Clock clock) {
        return new MetricsSnapshot(aggregate(tasks), byAgent(tasks), clock.instant());
    }

    public static TrustMetrics aggregate(Collection<Task> tasks) {
        Counts c = Counts.of(tasks);
        return new TrustMetrics(
                c.highConfidence, c.overriddenHighConfidence, c.falseConfidenceRate(),
                c.totalRetries, c.averageRetryVelocityMs(),
                c.requiringReview, c.reviewed, c.reviewRate(),
                c.averageConfidence());
    }

    /**
     * Metrics per agent for tasks that have an agent, ordered by agent id.
     * Unassigned tasks only contribute to {@link #aggregate}.
     */
    public static List<AgentTrustMetrics> byAgent(Collection<Task> tasks) {
        Map<String, List<Task>> grouped = new TreeMap<>();
        for (Task task : tasks) {
            if (task.agentId() != null) {
                grouped.computeIfAbsent(task.agentId(), k -> new ArrayList<>()).add(task);
            }
        }
        List<AgentTrustMetrics> result = new ArrayList<>(grouped.size());
        grouped.forEach((agentId, agentTasks) -> {
            Counts c = Counts.of(agentTasks);
            result.add(new AgentTrustMetrics(
                    agentId, agentTasks.size(), c.completed, c.cancelled,
                    c.highConfidence, c.overriddenHighConfidence, c.falseConfidenceRate(),
                    c.totalRetries, c.averageRetryVelocityMs(),
                    c.requiringReview, c.reviewed, c.reviewRate(),
                    c.averageConfidence()));
        });
        return result;
    }

    private static final class Counts {
        int highConfidence;
        int overriddenHighConfidence;
        int totalRetries;
        long retryVelocitySumMs;
        int retryVelocitySamples;
        int requiringReview;
        int reviewed;
        double confidenceSum;
        int confidenceSamples;
        int completed;
        int cancelled;

        static Counts of(Collection<Task> tasks) {
            Counts c = new Counts();
            for (Task t : tasks) {
                if (TrustPolicy.isHighConfidence(t.confidenceScore())) {
                    c.highConfidence++;
                    if (t.wasOverridden()) {
                        c.overriddenHighConfidence++;
                    }
                }
                if (t.retryCount() > 0 && t.firstAttemptAt() != null) {
                    c.totalRetries += t.retryCount();
                    if (t.status() == TaskStatus.DONE && t.updatedAt() != null) {
                        c.retryVelocitySumMs += Duration.between(t.firstAttemptAt(), t.updatedAt()).toMillis();
                        c.retryVelocitySamples++;
                    }
                }
                if (t.requiresReview()) {
                    c.requiringReview++;
                }
                if (t.reviewedAt() != null) {
                    c.reviewed++;
                }
                if (t.confidenceScore() != null) {
                    c.confidenceSum += t.confidenceScore();
                    c.confidenceSamples++;
                }
                if (t.status() == TaskStatus.DONE) {
                    c.completed++;
                } else if (t.status() == TaskStatus.CANCELLED) {
                    c.cancelled++;
                }
            }
            return c;
        }

        double falseConfidenceRate() {
            return highConfidence == 0 ? 0.0 : (double) overriddenHighConfidence / highConfidence;
        }

        Double averageRetryVelocityMs() {
            return retryVelocitySamples == 0 ? null : (double) retryVelocitySumMs / retryVelocitySamples;
        }

        double reviewRate() {
            return requiringReview == 0 ? 0.0 : (double) reviewed / requiringReview;
        }

        Double averageConfidence() {
            return confidenceSamples == 0 ? null : confidenceSum / confidenceSamples;
        }
    }
}
