package com.coordinator.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a registered worker agent. New agents start IDLE.
 */
public enum AgentStatus {
    IDLE,
    WORKING,
    WAITING,   // blocked on external input while holding a task
    ERROR,
    COMPLETED;

    public boolean canTransitionTo(AgentStatus target) {
        return allowedTargets().contains(target);
    }

    public Set<AgentStatus> allowedTargets() {
        return switch (this) {
            case IDLE -> EnumSet.of(WORKING);
            case WORKING -> EnumSet.of(WAITING, COMPLETED, ERROR);
            case WAITING -> EnumSet.of(WORKING);
            case ERROR, COMPLETED -> EnumSet.of(IDLE);
        };
    }
}
