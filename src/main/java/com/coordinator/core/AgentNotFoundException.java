package com.coordinator.core;

public class AgentNotFoundException extends CoordinatorException {
    public AgentNotFoundException(String agentId) {
        super("Agent not found: " + agentId);
    }
}
