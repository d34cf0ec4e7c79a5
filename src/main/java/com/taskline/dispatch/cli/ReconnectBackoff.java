package com.taskline.dispatch.cli;

import java.time.Duration;
import java.util.Optional;

/**
 * Exponential reconnect delays: {@code base * 2^n}, capped, for a limited
 * number of consecutive attempts. A successful connection resets the count.
 */
public class ReconnectBackoff {

    private final Duration base;
    private final Duration cap;
    private final int maxAttempts;
    private int attempts;

    public ReconnectBackoff(Duration base, Duration cap, int maxAttempts) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Max attempts must not be negative");
        }
        this.base = base;
        this.cap = cap;
        this.maxAttempts = maxAttempts;
    }

    public static ReconnectBackoff defaults() {
        return new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 10);
    }

    /**
     * Delay before the next attempt, or empty once the attempts are used up.
     */
    public Optional<Duration> nextDelay() {
        if (attempts >= maxAttempts) {
            return Optional.empty();
        }
        int exponent = Math.min(attempts, 30);
        attempts++;
        Duration delay = base.multipliedBy(1L << exponent);
        return Optional.of(delay.compareTo(cap) > 0 ? cap : delay);
    }

    public void reset() {
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
