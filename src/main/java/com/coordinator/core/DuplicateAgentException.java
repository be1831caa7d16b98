package com.coordinator.core;

/**
 * Thrown when an agent id is registered twice.
 */
public class DuplicateAgentException extends CoordinatorException {

    private final String agentId;

    public DuplicateAgentException(String agentId) {
        super("Agent already registered: " + agentId);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
