package com.coordinator.core;

/**
 * Thrown when a task or agent status change is not an allowed edge of its state machine.
 */
public class InvalidTransitionException extends CoordinatorException {

    private final String entityId;
    private final Enum<?> from;
    private final Enum<?> to;

    public InvalidTransitionException(String entity, String entityId, Enum<?> from, Enum<?> to) {
        super(entity + " " + entityId + ": invalid transition " + from + " -> " + to);
        this.entityId = entityId;
        this.from = from;
        this.to = to;
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getFrom() {
        return from;
    }

    public Enum<?> getTo() {
        return to;
    }
}
