package com.coordinator.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param title                required
 * @param description          free text
 * @param priority             LOW, MEDIUM, HIGH, CRITICAL or 1-4; nullable, defaults to MEDIUM
 * @param dependencies         task ids that must complete first
 * @param requiredCapabilities capability tags an agent must hold
 */
public record TaskRequest(
    String title,
    String description,
    String priority,
    List<String> dependencies,
    @JsonProperty("required_capabilities") List<String> requiredCapabilities
) {}
