package com.taskline.core.health;

import com.taskline.core.events.EventBroadcaster;
import com.taskline.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Probes the task store and the event broadcaster.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStore taskStore;
    private final EventBroadcaster broadcaster;

    public HealthCheckService(TaskStore taskStore, EventBroadcaster broadcaster) {
        this.taskStore = taskStore;
        this.broadcaster = broadcaster;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkBroadcaster());
        return results;
    }

    private HealthStatus checkStore() {
        String kind = taskStore.getClass().getSimpleName();
        try {
            if (taskStore.isAvailable()) {
                return HealthStatus.up("store", kind + " reachable", Map.of("type", kind));
            }
            return HealthStatus.down("store", kind + " not reachable", Map.of("type", kind));
        } catch (Exception e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return HealthStatus.down("store", "Store error: " + e.getMessage(), Map.of("type", kind));
        }
    }

    private HealthStatus checkBroadcaster() {
        Map<String, String> metadata = Map.of("subscribers", String.valueOf(broadcaster.totalSubscriberCount()));
        if (broadcaster.isRunning()) {
            return HealthStatus.up("broadcaster",
                    "Broadcasting to " + broadcaster.totalSubscriberCount() + " subscribers", metadata);
        }
        return HealthStatus.degraded("broadcaster", "Heartbeat scheduler not running", metadata);
    }
}
