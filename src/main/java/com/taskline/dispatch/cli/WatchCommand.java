package com.taskline.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * CLI command: taskline watch
 * <p>
 * Follows the live task stream of a running server. When the connection
 * drops it reconnects with exponential backoff and, since the server keeps
 * no backlog, re-fetches the task list instead of expecting missed events.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Watch live task events")
@Component
public class WatchCommand implements Runnable {

    @Option(names = {"--url"}, description = "Server base URL (default: ${DEFAULT-VALUE})",
            defaultValue = "http://localhost:8080")
    String baseUrl;

    @Option(names = {"--token", "-t"}, description = "Bearer token from /api/v1/auth/login")
    String token;

    @Option(names = {"--max-attempts"}, description = "Reconnect attempts before giving up (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    int maxAttempts;

    @Option(names = {"--quiet-heartbeats"}, description = "Do not print HEARTBEAT messages")
    boolean quietHeartbeats;

    private final ObjectMapper objectMapper;
    private final StringBuilder pendingData = new StringBuilder();

    public WatchCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching task events at " + baseUrl);

        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), maxAttempts);
        boolean connectedBefore = false;

        while (true) {
            try {
                HttpResponse<Stream<String>> response = client.send(
                        request("/api/v1/tasks/events").header("Accept", "text/event-stream").build(),
                        HttpResponse.BodyHandlers.ofLines());

                if (response.statusCode() != 200) {
                    response.body().close();
                }
                if (response.statusCode() == 401) {
                    ConsoleOutput.error("Authentication required: pass --token");
                    return;
                }
                if (response.statusCode() != 200) {
                    ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                } else {
                    backoff.reset();
                    if (connectedBefore) {
                        resync(client);
                    }
                    connectedBefore = true;
                    try (Stream<String> lines = response.body()) {
                        Iterator<String> it = lines.iterator();
                        while (it.hasNext()) {
                            handleLine(it.next());
                        }
                    }
                    ConsoleOutput.info("Stream ended.");
                }
            } catch (IOException | UncheckedIOException e) {
                ConsoleOutput.error("Connection lost: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ConsoleOutput.info("Watch interrupted.");
                return;
            }

            Optional<Duration> delay = backoff.nextDelay();
            if (delay.isEmpty()) {
                ConsoleOutput.error("Giving up after " + backoff.maxAttempts() + " reconnect attempts");
                return;
            }
            ConsoleOutput.info("Reconnecting in " + delay.get().toMillis() + "ms (attempt "
                    + backoff.attempts() + "/" + backoff.maxAttempts() + ")");
            try {
                Thread.sleep(delay.get().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Feeds one line of the SSE stream. {@code data:} lines accumulate until
     * the blank line that ends the message.
     */
    void handleLine(String line) {
        if (line.isEmpty()) {
            if (pendingData.length() > 0) {
                String data = pendingData.toString();
                pendingData.setLength(0);
                printMessage(data);
            }
            return;
        }
        if (line.startsWith("data:")) {
            if (pendingData.length() > 0) {
                pendingData.append('\n');
            }
            pendingData.append(line.substring(5).trim());
        }
        // event:, id:, retry: and ':' comment lines carry nothing we print
    }

    void printMessage(String data) {
        JsonNode message;
        try {
            message = objectMapper.readTree(data);
        } catch (IOException e) {
            ConsoleOutput.error("Unparseable message: " + data);
            return;
        }
        String type = message.path("type").asText("UNKNOWN");
        if ("HEARTBEAT".equals(type) && quietHeartbeats) {
            return;
        }
        ConsoleOutput.streamMessage(type, describe(message));
    }

    static String describe(JsonNode message) {
        JsonNode task = message.path("data");
        if (task.isObject()) {
            return task.path("id").asText() + " \"" + task.path("title").asText() + "\" "
                    + task.path("status").asText()
                    + (task.path("requiresReview").asBoolean() ? " (needs review)" : "");
        }
        if (message.hasNonNull("taskId")) {
            return message.get("taskId").asText();
        }
        return message.path("timestamp").asText();
    }

    private void resync(HttpClient client) throws IOException, InterruptedException {
        HttpResponse<String> response = client.send(request("/api/v1/tasks").GET().build(),
                HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            ConsoleOutput.error("Re-sync failed: HTTP " + response.statusCode());
            return;
        }
        JsonNode tasks = objectMapper.readTree(response.body());
        ConsoleOutput.info("Re-synced " + tasks.size() + " tasks after reconnect");
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(stripSlash(baseUrl) + path));
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
