package com.coordinator.core.model;

/**
 * Priority band of a task. Higher {@link #level()} is scheduled first.
 */
public enum TaskPriority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static TaskPriority fromLevel(int level) {
        for (TaskPriority p : values()) {
            if (p.level == level) return p;
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }
}
