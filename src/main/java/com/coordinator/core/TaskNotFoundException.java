package com.coordinator.core;

public class TaskNotFoundException extends CoordinatorException {
    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
    }
}
