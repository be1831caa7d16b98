package com.coordinator.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: coordinator health
 * <p>
 * Asks a running coordinator for its component health. Exits 0 when every component is UP.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check health of a running coordinator")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    @Option(names = {"--host"}, description = "Server host (default: ${DEFAULT-VALUE})", defaultValue = "localhost")
    private String host;

    private final ObjectMapper objectMapper;

    public HealthCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        CoordinatorClient client = new CoordinatorClient(objectMapper, host, port);
        try {
            // 503 still carries the component breakdown
            CoordinatorClient.Reply reply = client.get("/api/v1/health");
            if (reply.statusCode() != 200 && reply.statusCode() != 503) {
                ConsoleOutput.error("Server returned HTTP " + reply.statusCode());
                return 1;
            }
            return render(reply.body()) ? 0 : 1;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to coordinator at " + client.address());
            ConsoleOutput.info("Start the server first: coordinator serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Health request interrupted.");
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Health request failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Prints one line per component and the overall verdict. Returns true when all are UP.
     */
    boolean render(JsonNode health) {
        boolean allUp = "UP".equals(health.path("status").asText());

        Iterator<Map.Entry<String, JsonNode>> components = health.path("components").fields();
        while (components.hasNext()) {
            Map.Entry<String, JsonNode> component = components.next();
            String status = component.getValue().path("status").asText("UNKNOWN");
            String label = component.getKey() + ": " + component.getValue().path("detail").asText("");
            switch (status) {
                case "UP" -> ConsoleOutput.success(label);
                case "DEGRADED" -> {
                    ConsoleOutput.info(label + " (degraded)");
                    allUp = false;
                }
                default -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
            }
        }

        ConsoleOutput.rule();
        if (allUp) {
            ConsoleOutput.success("Overall: all components operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return allUp;
    }
}
