package com.coordinator.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/messages.
 */
public record MessageRequest(
    @JsonProperty("from_agent") String fromAgent,
    @JsonProperty("to_agent") String toAgent,
    @JsonProperty("message_type") String messageType,
    String content,
    @JsonProperty("task_id") String taskId
) {}
