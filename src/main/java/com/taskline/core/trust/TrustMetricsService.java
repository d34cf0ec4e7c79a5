package com.taskline.core.trust;

import com.taskline.core.metrics.TasklineMetrics;
import com.taskline.core.model.Task;
import com.taskline.core.model.TaskFilter;
import com.taskline.core.store.StoreReads;
import com.taskline.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Loads a user's tasks and hands them to {@link TrustMetricsEngine}.
 */
@Service
public class TrustMetricsService {

    private static final Logger log = LoggerFactory.getLogger(TrustMetricsService.class);

    private final TaskStore store;
    private final StoreReads reads;
    private final TasklineMetrics metrics;
    private final Clock clock;

    public TrustMetricsService(TaskStore store, StoreReads reads, TasklineMetrics metrics, Clock clock) {
        this.store = store;
        this.reads = reads;
        this.metrics = metrics;
        this.clock = clock;
    }

    public MetricsSnapshot snapshot(String userId) {
        long start = System.currentTimeMillis();
        List<Task> tasks = reads.read("listByOwner", () -> store.listByOwner(userId, TaskFilter.none()));
        MetricsSnapshot snapshot = TrustMetricsEngine.snapshot(tasks, clock);
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordTrustComputation(tasks.size(), elapsed);
        log.debug("Computed trust metrics for user {} over {} tasks in {}ms", userId, tasks.size(), elapsed);
        return snapshot;
    }
}
