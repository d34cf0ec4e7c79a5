package com.taskline.dispatch.cli;

import com.taskline.core.trust.AgentTrustMetrics;
import com.taskline.core.trust.MetricsSnapshot;
import com.taskline.core.trust.TrustMetrics;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Taskline CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKLINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKLINE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void streamMessage(String type, String detail) {
        String prefix = switch (type) {
            case "CONNECTED" -> "@|fg(green) [CONNECTED]|@";
            case "HEARTBEAT" -> "@|faint [HEARTBEAT]|@";
            case "TASK_CREATED" -> "@|fg(cyan) [CREATED]|@";
            case "TASK_UPDATED" -> "@|fg(blue) [UPDATED]|@";
            case "TASK_DELETED" -> "@|fg(red) [DELETED]|@";
            default -> "@|fg(white) [" + type + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + detail));
    }

    public static void trustMetrics(String userId, MetricsSnapshot snapshot) {
        TrustMetrics m = snapshot.aggregate();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Trust Metrics|@ for " + userId + " at " + snapshot.timestamp()));
        System.out.println("  High-confidence tasks: " + m.totalHighConfidenceTasks()
                + " (" + m.overriddenHighConfidenceTasks() + " overridden)");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  False confidence rate: " + rate(m.falseConfidenceRate(), 0.2)));
        System.out.println("  Retries: " + m.totalRetries()
                + ", avg velocity: " + formatDuration(m.averageRetryVelocityMs()));
        System.out.println("  Review: " + m.tasksReviewed() + "/" + m.tasksRequiringReview()
                + " (" + percent(m.reviewRate()) + ")");
        System.out.println("  Avg confidence: " + percent(m.averageConfidence()));

        if (!snapshot.byAgent().isEmpty()) {
            System.out.println();
            System.out.printf("  %-20s %6s %6s %6s %8s %8s%n",
                    "AGENT", "TASKS", "DONE", "CANC", "FALSE%", "AVGCONF");
            System.out.println("  " + "-".repeat(60));
            for (AgentTrustMetrics a : snapshot.byAgent()) {
                System.out.printf("  %-20s %6d %6d %6d %8s %8s%n",
                        truncate(a.agentId(), 20), a.totalTasks(), a.completedTasks(), a.failedTasks(),
                        percent(a.falseConfidenceRate()), percent(a.averageConfidence()));
            }
        }
    }

    private static String rate(double value, double warnAbove) {
        String color = value > warnAbove ? "fg(red)" : "fg(green)";
        return "@|" + color + " " + percent(value) + "|@";
    }

    private static String percent(Double value) {
        if (value == null) return "-";
        return String.format("%.1f%%", value * 100);
    }

    static String formatDuration(Double ms) {
        if (ms == null) return "-";
        long millis = Math.round(ms);
        if (millis < 1000) return millis + "ms";
        long seconds = millis / 1000;
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
