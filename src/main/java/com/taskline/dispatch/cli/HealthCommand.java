package com.taskline.dispatch.cli;

import com.taskline.core.health.HealthCheckService;
import com.taskline.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI command: taskline health
 * <p>
 * Probes the configured task store and the event broadcaster in-process and
 * prints one line per component with its metadata (store type, subscriber count).
 * Exits with 1 when any component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check task store and broadcaster health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail() + describe(check.metadata());
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (checks.stream().allMatch(HealthStatus::isUp)) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return checks.stream().anyMatch(HealthStatus::isDown) ? 1 : 0;
    }

    static String describe(Map<String, String> metadata) {
        if (metadata.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(" (");
        new TreeMap<>(metadata).forEach((key, value) -> {
            if (sb.length() > 2) {
                sb.append(", ");
            }
            sb.append(key).append('=').append(value);
        });
        return sb.append(')').toString();
    }
}
