package com.coordinator.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * A unit of work in the coordinator queue. Records are immutable; every
 * lifecycle change produces a new instance through one of the {@code with*} methods.
 *
 * @param id                   unique identifier (e.g. "TASK-3f1c...")
 * @param title                short human-readable title
 * @param description          what the task should accomplish
 * @param priority             scheduling band
 * @param status               current lifecycle status
 * @param assignedAgent        agent bound to the task; non-null only while ASSIGNED or IN_PROGRESS
 * @param dependencies         IDs of tasks that must be COMPLETED before this one is ready
 * @param requiredCapabilities capability tags an agent must hold to take the task
 * @param createdAt            creation time
 * @param startedAt            time of the first assignment; kept across retries
 * @param assignedAt           start of the current attempt, used for timeouts
 * @param completedAt          time the task reached a terminal status
 * @param sequence             insertion order, the FIFO tie-break within a priority
 * @param result               success payload
 * @param error                last failure message
 * @param retryCount           failed attempts so far
 * @param cancelRequested      cancellation was requested while an agent held the task
 */
public record Task(
    String id,
    String title,
    String description,
    TaskPriority priority,
    TaskStatus status,
    String assignedAgent,
    Set<String> dependencies,
    Set<String> requiredCapabilities,
    Instant createdAt,
    Instant startedAt,
    Instant assignedAt,
    Instant completedAt,
    long sequence,
    String result,
    String error,
    int retryCount,
    boolean cancelRequested
) implements Serializable {

    public Task {
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        requiredCapabilities = requiredCapabilities == null ? Set.of() : Set.copyOf(requiredCapabilities);
    }

    public static Task pending(String id, String title, String description, TaskPriority priority,
                               Set<String> dependencies, Set<String> requiredCapabilities,
                               Instant createdAt, long sequence) {
        return new Task(id, title, description, priority, TaskStatus.PENDING, null,
                dependencies, requiredCapabilities, createdAt, null, null, null,
                sequence, null, null, 0, false);
    }

    public Task withAssignment(String agentId, Instant now) {
        return new Task(id, title, description, priority, TaskStatus.ASSIGNED, agentId,
                dependencies, requiredCapabilities, createdAt,
                startedAt != null ? startedAt : now, now, completedAt,
                sequence, result, error, retryCount, cancelRequested);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, title, description, priority, newStatus, assignedAgent,
                dependencies, requiredCapabilities, createdAt, startedAt, assignedAt, completedAt,
                sequence, result, error, retryCount, cancelRequested);
    }

    public Task withCompletion(String taskResult, Instant now) {
        return new Task(id, title, description, priority, TaskStatus.COMPLETED, null,
                dependencies, requiredCapabilities, createdAt, startedAt, null, now,
                sequence, taskResult, null, retryCount, cancelRequested);
    }

    /**
     * Records a failed attempt. The task either re-enters the pool as PENDING or
     * lands in {@code terminalStatus} (FAILED or CANCELLED).
     */
    public Task withFailure(String failure, boolean retry, TaskStatus terminalStatus, Instant now) {
        TaskStatus next = retry ? TaskStatus.PENDING : terminalStatus;
        return new Task(id, title, description, priority, next, null,
                dependencies, requiredCapabilities, createdAt, startedAt, null,
                retry ? null : now, sequence, null, failure, retryCount + 1, cancelRequested);
    }

    public Task withCancellation(Instant now) {
        return new Task(id, title, description, priority, TaskStatus.CANCELLED, null,
                dependencies, requiredCapabilities, createdAt, startedAt, null, now,
                sequence, result, error, retryCount, true);
    }

    public Task withCancelRequested() {
        return new Task(id, title, description, priority, status, assignedAgent,
                dependencies, requiredCapabilities, createdAt, startedAt, assignedAt, completedAt,
                sequence, result, error, retryCount, true);
    }
}
