package com.taskline.core.trust;

/**
 * Confidence thresholds shared by the state machine and the metrics engine.
 */
public final class TrustPolicy {

    /** Scores at or above this count as high confidence. */
    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.7;

    /** Scores below this flag the task for human review. */
    public static final double LOW_CONFIDENCE_THRESHOLD = 0.5;

    private TrustPolicy() {}

    public static boolean isHighConfidence(Double confidenceScore) {
        return confidenceScore != null && confidenceScore >= HIGH_CONFIDENCE_THRESHOLD;
    }

    public static boolean shouldRequireReview(Double confidenceScore) {
        return confidenceScore != null && confidenceScore < LOW_CONFIDENCE_THRESHOLD;
    }
}
