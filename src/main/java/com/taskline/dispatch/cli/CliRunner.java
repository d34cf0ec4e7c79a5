package com.taskline.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the picocli command tree once the Spring context is up, so commands
 * get the same store, broadcaster and metrics beans as the server.
 * The exit code of the last command becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TasklineCommand tasklineCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TasklineCommand tasklineCommand, IFactory factory) {
        this.tasklineCommand = tasklineCommand;
        this.factory = factory;
    }

    /**
     * No arguments, or a {@code serve} argument anywhere, starts the HTTP server.
     */
    public static boolean isServeMode(String... args) {
        return args.length == 0 || Arrays.asList(args).contains("serve");
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            // the embedded web server keeps the JVM alive
            return;
        }
        exitCode = new CommandLine(tasklineCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
