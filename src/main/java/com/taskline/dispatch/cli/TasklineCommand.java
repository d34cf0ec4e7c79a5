package com.taskline.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Taskline.
 * Routes to subcommands: serve, health, metrics, watch.
 */
@Command(
        name = "taskline",
        mixinStandardHelpOptions = true,
        version = "Taskline 0.1.0",
        description = "Task lifecycle engine for agent-delegated work",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                MetricsCommand.class,
                WatchCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TasklineCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
