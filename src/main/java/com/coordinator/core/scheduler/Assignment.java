package com.coordinator.core.scheduler;

/**
 * One task-to-agent match made during a scheduling tick.
 */
public record Assignment(String taskId, String agentId) {}
