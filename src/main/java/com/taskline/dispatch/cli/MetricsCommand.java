package com.taskline.dispatch.cli;

import com.taskline.core.trust.MetricsSnapshot;
import com.taskline.core.trust.TrustMetricsService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskline metrics &lt;user-id&gt;
 * <p>
 * Computes trust metrics straight from the configured task store.
 */
@Command(name = "metrics", mixinStandardHelpOptions = true, description = "Show trust metrics for a user")
@Component
public class MetricsCommand implements Runnable {

    @Parameters(index = "0", description = "User ID")
    String userId;

    private final TrustMetricsService trustMetricsService;

    public MetricsCommand(TrustMetricsService trustMetricsService) {
        this.trustMetricsService = trustMetricsService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        MetricsSnapshot snapshot = trustMetricsService.snapshot(userId);
        if (snapshot.aggregate().averageConfidence() == null && snapshot.byAgent().isEmpty()
                && snapshot.aggregate().tasksRequiringReview() == 0) {
            ConsoleOutput.info("No scored tasks for " + userId);
        }
        ConsoleOutput.trustMetrics(userId, snapshot);
    }
}
