package com.coordinator.core.model;

import java.util.Set;

/**
 * Agent definition returned by an {@code AgentTemplateProvider} for a role and instance id.
 * The coordinator treats {@code prompt} and {@code projectPath} as opaque.
 */
public record AgentTemplate(
    String id,
    String name,
    String role,
    Set<String> capabilities,
    String projectPath,
    int maxConcurrentTasks,
    String prompt
) {}
