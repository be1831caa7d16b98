package com.coordinator.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private Task pending() {
        return Task.pending("TASK-1", "Build API", "REST endpoints", TaskPriority.HIGH,
                Set.of("TASK-0"), Set.of("java"), T0, 0);
    }

    @Test
    @DisplayName("pending task starts unassigned with no attempts")
    void pendingDefaults() {
        Task task = pending();
        assertEquals(TaskStatus.PENDING, task.status());
        assertNull(task.assignedAgent());
        assertEquals(0, task.retryCount());
        assertFalse(task.cancelRequested());
    }

    @Test
    @DisplayName("dependency and capability sets are copied defensively")
    void setsAreCopied() {
        var deps = new HashSet<>(Set.of("A"));
        Task task = Task.pending("TASK-1", "t", null, TaskPriority.LOW, deps, null, T0, 0);
        deps.add("B");
        assertEquals(Set.of("A"), task.dependencies());
        assertEquals(Set.of(), task.requiredCapabilities());
    }

    @Test
    @DisplayName("startedAt is kept from the first assignment across retries")
    void startedAtKeptAcrossRetries() {
        Instant later = T0.plusSeconds(600);
        Task first = pending().withAssignment("agent-1", T0.plusSeconds(1));
        Task retried = first.withFailure("boom", true, TaskStatus.FAILED, T0.plusSeconds(2));
        Task second = retried.withAssignment("agent-2", later);

        assertEquals(T0.plusSeconds(1), second.startedAt());
        assertEquals(later, second.assignedAt());
        assertEquals("agent-2", second.assignedAgent());
    }

    @Test
    @DisplayName("retried failure returns to PENDING without an agent")
    void retriedFailure() {
        Task failed = pending().withAssignment("agent-1", T0)
                .withFailure("boom", true, TaskStatus.FAILED, T0.plusSeconds(5));
        assertEquals(TaskStatus.PENDING, failed.status());
        assertNull(failed.assignedAgent());
        assertNull(failed.completedAt());
        assertEquals(1, failed.retryCount());
        assertEquals("boom", failed.error());
    }

    @Test
    @DisplayName("terminal failure stamps completedAt")
    void terminalFailure() {
        Task failed = pending().withAssignment("agent-1", T0)
                .withFailure("boom", false, TaskStatus.FAILED, T0.plusSeconds(5));
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(T0.plusSeconds(5), failed.completedAt());
    }

    @Test
    @DisplayName("completion clears the agent and previous error")
    void completion() {
        Task done = pending().withAssignment("agent-1", T0)
                .withFailure("flaky", true, TaskStatus.FAILED, T0)
                .withAssignment("agent-1", T0)
                .withCompletion("ok", T0.plusSeconds(9));
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertNull(done.assignedAgent());
        assertNull(done.error());
        assertEquals("ok", done.result());
        assertEquals(1, done.retryCount());
    }
}
