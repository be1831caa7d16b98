package com.coordinator.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a task in the coordinator queue.
 * <p>
 * ASSIGNED and IN_PROGRESS may fall back to PENDING when a failed attempt is retried.
 */
public enum TaskStatus {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }

    public Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(ASSIGNED, CANCELLED);
            case ASSIGNED -> EnumSet.of(IN_PROGRESS, COMPLETED, FAILED, PENDING, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, PENDING, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** True while an agent is bound to the task. */
    public boolean isActive() {
        return this == ASSIGNED || this == IN_PROGRESS;
    }
}
