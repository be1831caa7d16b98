package com.coordinator.core.engine;

import com.coordinator.core.model.Agent;
import com.coordinator.core.model.AgentMessage;
import com.coordinator.core.model.Task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds JSON-friendly event payloads. Times become epoch millis, sets become sorted lists,
 * and null values are kept as explicit nulls.
 */
final class EventPayloads {

    private EventPayloads() {}

    static Map<String, Object> agentRegistered(Agent agent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", agent.id());
        payload.put("agent_name", agent.name());
        payload.put("role", agent.role());
        payload.put("capabilities", new ArrayList<>(new TreeSet<>(agent.capabilities())));
        return payload;
    }

    static Map<String, Object> agentStatusChanged(Agent before, Agent after) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", after.id());
        payload.put("from", before.status().name().toLowerCase());
        payload.put("to", after.status().name().toLowerCase());
        payload.put("current_task", after.currentTask());
        return payload;
    }

    static Map<String, Object> task(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", task.id());
        payload.put("title", task.title());
        payload.put("description", task.description());
        payload.put("priority", task.priority().level());
        payload.put("status", task.status().name().toLowerCase());
        payload.put("assigned_agent", task.assignedAgent());
        payload.put("dependencies", new ArrayList<>(new TreeSet<>(task.dependencies())));
        payload.put("required_capabilities", new ArrayList<>(new TreeSet<>(task.requiredCapabilities())));
        payload.put("created_at", millis(task.createdAt()));
        payload.put("started_at", millis(task.startedAt()));
        payload.put("completed_at", millis(task.completedAt()));
        payload.put("result", task.result());
        payload.put("error", task.error());
        payload.put("retry_count", task.retryCount());
        return payload;
    }

    static Map<String, Object> taskAssigned(Task task, Agent agent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.id());
        payload.put("agent_id", agent.id());
        payload.put("agent_name", agent.name());
        payload.put("title", task.title());
        payload.put("priority", task.priority().level());
        return payload;
    }

    static Map<String, Object> taskOutcome(Task task, String agentId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.id());
        payload.put("agent_id", agentId);
        payload.put("status", task.status().name().toLowerCase());
        payload.put("retry_count", task.retryCount());
        payload.put("result", task.result());
        payload.put("error", task.error());
        return payload;
    }

    static Map<String, Object> message(AgentMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message_id", message.id());
        payload.put("sequence", message.sequence());
        payload.put("from_agent", message.fromAgent());
        payload.put("to_agent", message.toAgent());
        payload.put("message_type", message.messageType());
        payload.put("task_id", message.taskId());
        return payload;
    }

    private static Long millis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }
}
