package com.taskline.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskline serve
 * <p>
 * Starts the HTTP server with the task API and the live event stream. The
 * web server is enabled by {@link com.taskline.TasklineApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli so the
 * embedded server keeps the JVM alive.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Taskline HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached via --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Taskline server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/tasks/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
