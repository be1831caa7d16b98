package com.coordinator.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;

/**
 * CLI command: coordinator status
 * <p>
 * Fetches the status snapshot from a running coordinator and prints agent and task tables.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show agents and tasks of a running coordinator")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    @Option(names = {"--host"}, description = "Server host (default: ${DEFAULT-VALUE})", defaultValue = "localhost")
    private String host;

    private final ObjectMapper objectMapper;

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        CoordinatorClient client = new CoordinatorClient(objectMapper, host, port);
        try {
            CoordinatorClient.Reply reply = client.get("/api/v1/status");
            if (reply.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + reply.statusCode());
                return;
            }
            render(reply.body());
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to coordinator at " + client.address());
            ConsoleOutput.info("Start the server first: coordinator serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Status request interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Status request failed: " + e.getMessage());
        }
    }

    void render(JsonNode status) {
        if (status.path("running").asBoolean()) {
            ConsoleOutput.success("Coordination loop running");
        } else {
            ConsoleOutput.info("Coordination loop stopped");
        }
        ConsoleOutput.info("Pending tasks: " + status.path("queue_size").asInt()
                + " | Messages: " + status.path("message_count").asInt());

        JsonNode agents = status.path("agents");
        System.out.println();
        System.out.printf("  %-20s %-20s %-10s %s%n", "AGENT", "ROLE", "STATUS", "TASK");
        System.out.println("  " + "-".repeat(70));
        for (JsonNode agent : agents) {
            System.out.printf("  %-20s %-20s %-10s %s%n",
                    agent.path("id").asText(),
                    truncate(agent.path("role").asText(""), 20),
                    agent.path("status").asText(),
                    agent.path("current_task").asText("-"));
        }

        JsonNode tasks = status.path("tasks");
        System.out.println();
        // task ids are printed whole, never truncated
        System.out.printf("  %-41s %-9s %-12s %-16s %s%n", "TASK", "PRIORITY", "STATUS", "AGENT", "TITLE");
        System.out.println("  " + "-".repeat(110));
        for (JsonNode task : tasks) {
            System.out.printf("  %-41s %-9s %-12s %-16s %s%n",
                    task.path("id").asText(),
                    task.path("priority").asText(),
                    task.path("status").asText(),
                    task.path("assigned_agent").asText("-"),
                    truncate(task.path("title").asText(), 30));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty() || "null".equals(s)) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
