package com.coordinator.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted by the coordinator.
 *
 * @param eventType event name (e.g. "agent_registered", "task_created", "task_assigned")
 * @param sessionId coordinator session the event belongs to
 * @param payload   event-specific fields
 * @param timestamp when the event was published
 */
public record CoordinatorEvent(
    String eventType,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
