package com.taskline.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for the task lifecycle engine.
 */
@Service
public class TasklineMetrics {

    private final MeterRegistry registry;

    public TasklineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String from, String to) {
        Counter.builder("taskline.task.transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordRejectedTransition(String from, String to) {
        Counter.builder("taskline.task.transitions.rejected")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    /**
     * Records a retry. {@code fromStatus} is the status the retry forced the
     * task out of, which makes bypasses of the transition table visible.
     */
    public void recordRetry(String fromStatus) {
        Counter.builder("taskline.task.retries")
                .tag("from", fromStatus)
                .register(registry)
                .increment();
    }

    public void recordMutation(String operation, String outcome, long ms) {
        Timer.builder("taskline.task.mutation.duration")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStoreReadRetry() {
        Counter.builder("taskline.store.read.retries")
                .description("Store reads retried after a storage failure")
                .register(registry)
                .increment();
    }

    // --- Event distribution ---

    public void recordEventPublished(String type) {
        Counter.builder("taskline.events.published")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    /**
     * Records an event that one subscriber did not receive.
     *
     * @param reason "buffer_full" or "channel_closed"
     */
    public void recordEventDropped(String reason) {
        Counter.builder("taskline.events.dropped")
                .description("Events dropped for a single subscriber")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void registerSubscriberGauge(Supplier<Number> activeSubscribers) {
        Gauge.builder("taskline.events.subscribers", activeSubscribers)
                .description("Currently registered subscriber channels")
                .register(registry);
    }

    // --- Trust metrics ---

    public void recordTrustComputation(int taskCount, long ms) {
        Timer.builder("taskline.trust.computation.duration")
                .tag("size", taskCount < 100 ? "small" : taskCount < 1000 ? "medium" : "large")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
