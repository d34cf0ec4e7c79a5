package com.taskline.core.trust;

import java.time.Instant;
import java.util.List;

public record MetricsSnapshot(
    TrustMetrics aggregate,
    List<AgentTrustMetrics> byAgent,
    Instant timestamp
) {

    public MetricsSnapshot {
        byAgent = byAgent != null ? List.copyOf(byAgent) : List.of();
    }
}
