package com.coordinator.core.scheduler;

import com.coordinator.core.model.Agent;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.model.Task;
import com.coordinator.core.model.TaskPriority;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.core.registry.AgentRegistry;
import com.coordinator.core.task.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private TaskStore store;
    private AgentRegistry registry;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new TaskStore();
        registry = new AgentRegistry();
        scheduler = new TaskScheduler(store, registry, new DependencyAnalyzer());
    }

    private Task task(String title, TaskPriority priority, Instant createdAt, Set<String> caps, String... deps) {
        return store.create(title, null, priority, Set.of(deps), caps, createdAt);
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("higher priority first, then creation order")
        void readyOrder() {
            task("low-first", TaskPriority.LOW, T0, Set.of());
            task("high-second", TaskPriority.HIGH, T0.plusSeconds(10), Set.of());
            task("high-third", TaskPriority.HIGH, T0.plusSeconds(10), Set.of());
            task("medium-fourth", TaskPriority.MEDIUM, T0.plusSeconds(20), Set.of());

            var titles = scheduler.readyTasks().stream().map(Task::title).toList();
            assertEquals(List.of("high-second", "high-third", "medium-fourth", "low-first"), titles);
        }

        @Test
        @DisplayName("a clock stepping back does not let a later task jump the queue")
        void clockStepBack() {
            task("earlier", TaskPriority.HIGH, T0, Set.of());
            task("later", TaskPriority.HIGH, T0.minusSeconds(30), Set.of());

            var titles = scheduler.readyTasks().stream().map(Task::title).toList();
            assertEquals(List.of("earlier", "later"), titles);
        }

        @Test
        @DisplayName("READY_ORDER compares priority level descending")
        void comparator() {
            Task critical = Task.pending("c", "c", null, TaskPriority.CRITICAL, Set.of(), Set.of(), T0.plusSeconds(5), 5);
            Task medium = Task.pending("m", "m", null, TaskPriority.MEDIUM, Set.of(), Set.of(), T0, 0);
            assertTrue(TaskOrdering.READY_ORDER.compare(critical, medium) < 0);
        }
    }

    @Nested
    @DisplayName("tick")
    class Tick {

        @Test
        @DisplayName("assigns the most urgent ready task to the idle agent")
        void assignsMostUrgent() {
            registry.register(Agent.of("a1", "A1", "dev", Set.of()), T0);
            task("medium", TaskPriority.MEDIUM, T0, Set.of());
            Task high = task("high", TaskPriority.HIGH, T0, Set.of());

            TickResult result = scheduler.tick(5, T0.plusSeconds(1));

            assertEquals(List.of(new Assignment(high.id(), "a1")), result.assignments());
            assertEquals(2, result.readyCount());
            assertEquals(1, result.pendingCount());

            Task assigned = store.get(high.id());
            assertEquals(TaskStatus.ASSIGNED, assigned.status());
            assertEquals("a1", assigned.assignedAgent());
            assertEquals(T0.plusSeconds(1), assigned.assignedAt());

            Agent agent = registry.get("a1");
            assertEquals(AgentStatus.WORKING, agent.status());
            assertEquals(high.id(), agent.currentTask());
        }

        @Test
        @DisplayName("task with unmet capabilities stays pending while a lower-priority task proceeds")
        void capabilitySkip() {
            registry.register(Agent.of("fe", "FE", "frontend", Set.of("react")), T0);
            Task needsJava = task("java-task", TaskPriority.CRITICAL, T0, Set.of("java"));
            Task needsReact = task("react-task", TaskPriority.LOW, T0, Set.of("react"));

            TickResult result = scheduler.tick(5, T0);

            assertEquals(1, result.assignments().size());
            assertEquals(needsReact.id(), result.assignments().get(0).taskId());
            assertEquals(TaskStatus.PENDING, store.get(needsJava.id()).status());
        }

        @Test
        @DisplayName("task whose capabilities no agent has stays pending across ticks")
        void capabilityMismatchKeepsAgentIdle() {
            registry.register(Agent.of("x", "X", "dev", Set.of("python")), T0);
            Task goTask = task("go-task", TaskPriority.HIGH, T0, Set.of("go"));

            for (int i = 0; i < 3; i++) {
                TickResult result = scheduler.tick(5, T0.plusSeconds(i));
                assertTrue(result.assignments().isEmpty());
                assertEquals(1, result.pendingCount());
            }

            assertEquals(TaskStatus.PENDING, store.get(goTask.id()).status());
            assertEquals(List.of(goTask.id()), scheduler.readyTasks().stream().map(Task::id).toList());
            Agent x = registry.get("x");
            assertEquals(AgentStatus.IDLE, x.status());
            assertNull(x.currentTask());
        }

        @Test
        @DisplayName("respects the busy agent cap, counting waiting agents")
        void busyCap() {
            registry.register(Agent.of("a", "A", "dev", Set.of()), T0);
            registry.register(Agent.of("b", "B", "dev", Set.of()), T0);
            registry.register(Agent.of("c", "C", "dev", Set.of()), T0);
            registry.transition("c", AgentStatus.WORKING, "TASK-other", T0);
            registry.transition("c", AgentStatus.WAITING, null, T0);
            task("t1", TaskPriority.MEDIUM, T0, Set.of());
            task("t2", TaskPriority.MEDIUM, T0, Set.of());

            TickResult result = scheduler.tick(2, T0);

            assertEquals(1, result.assignments().size());
            assertEquals(1, store.countByStatus(TaskStatus.PENDING));
        }

        @Test
        @DisplayName("dependent task waits for its dependency to complete")
        void dependencyGate() {
            registry.register(Agent.of("a", "A", "dev", Set.of()), T0);
            registry.register(Agent.of("b", "B", "dev", Set.of()), T0);
            Task first = task("first", TaskPriority.LOW, T0, Set.of());
            Task second = task("second", TaskPriority.CRITICAL, T0, Set.of(), first.id());

            TickResult result = scheduler.tick(5, T0);

            assertEquals(1, result.assignments().size());
            assertEquals(first.id(), result.assignments().get(0).taskId());
            assertEquals(TaskStatus.PENDING, store.get(second.id()).status());
        }

        @Test
        @DisplayName("no ready tasks yields an empty result")
        void nothingReady() {
            registry.register(Agent.of("a", "A", "dev", Set.of()), T0);
            task("blocked", TaskPriority.HIGH, T0, Set.of(), "GHOST");

            TickResult result = scheduler.tick(5, T0);
            assertTrue(result.assignments().isEmpty());
            assertEquals(0, result.readyCount());
            assertEquals(1, result.pendingCount());
            assertEquals(AgentStatus.IDLE, registry.get("a").status());
        }

        @Test
        @DisplayName("each agent receives at most one task per tick")
        void oneTaskPerAgent() {
            registry.register(Agent.of("a", "A", "dev", Set.of()), T0);
            task("t1", TaskPriority.HIGH, T0, Set.of());
            task("t2", TaskPriority.HIGH, T0, Set.of());
            task("t3", TaskPriority.HIGH, T0, Set.of());

            TickResult result = scheduler.tick(5, T0);
            assertEquals(1, result.assignments().size());
            assertEquals(2, result.pendingCount());
        }
    }
}
