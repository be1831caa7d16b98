package com.coordinator.dispatch.api;

import com.coordinator.core.model.Agent;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.TreeSet;

/**
 * JSON representation of an agent.
 */
public record AgentResponse(
    String id,
    String name,
    String role,
    List<String> capabilities,
    String status,
    @JsonProperty("current_task") String currentTask,
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("max_concurrent_tasks") int maxConcurrentTasks,
    @JsonProperty("last_activity") Long lastActivity
) {

    public static AgentResponse from(Agent agent) {
        return new AgentResponse(
                agent.id(),
                agent.name(),
                agent.role(),
                List.copyOf(new TreeSet<>(agent.capabilities())),
                agent.status().name().toLowerCase(),
                agent.currentTask(),
                agent.projectPath(),
                agent.maxConcurrentTasks(),
                agent.lastActivity() != null ? agent.lastActivity().toEpochMilli() : null);
    }
}
