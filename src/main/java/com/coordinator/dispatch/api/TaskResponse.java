package com.coordinator.dispatch.api;

import com.coordinator.core.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * JSON representation of a task, including dependencies that are not yet completed.
 */
public record TaskResponse(
    String id,
    String title,
    String description,
    int priority,
    String status,
    @JsonProperty("assigned_agent") String assignedAgent,
    List<String> dependencies,
    @JsonProperty("unmet_dependencies") List<String> unmetDependencies,
    @JsonProperty("required_capabilities") List<String> requiredCapabilities,
    @JsonProperty("created_at") Long createdAt,
    @JsonProperty("started_at") Long startedAt,
    @JsonProperty("completed_at") Long completedAt,
    String result,
    String error,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("cancel_requested") boolean cancelRequested
) {

    public static TaskResponse from(Task task, Set<String> unmet) {
        return new TaskResponse(
                task.id(),
                task.title(),
                task.description(),
                task.priority().level(),
                task.status().name().toLowerCase(),
                task.assignedAgent(),
                List.copyOf(new TreeSet<>(task.dependencies())),
                List.copyOf(unmet),
                List.copyOf(new TreeSet<>(task.requiredCapabilities())),
                millis(task.createdAt()),
                millis(task.startedAt()),
                millis(task.completedAt()),
                task.result(),
                task.error(),
                task.retryCount(),
                task.cancelRequested());
    }

    private static Long millis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }
}
