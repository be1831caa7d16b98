package com.coordinator.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorMetricsTest {

    private SimpleMeterRegistry registry;
    private CoordinatorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CoordinatorMetrics(registry);
    }

    @Test
    @DisplayName("recordAgentRegistered counts by role, with unknown for null")
    void agentRegistered() {
        metrics.recordAgentRegistered("qa_tester");
        metrics.recordAgentRegistered(null);

        assertEquals(1.0, registry.find("coordinator.agents.registered").tag("role", "qa_tester").counter().count());
        assertEquals(1.0, registry.find("coordinator.agents.registered").tag("role", "unknown").counter().count());
    }

    @Test
    @DisplayName("recordTick records duration and assignment count")
    void tick() {
        metrics.recordTick(3, 12);
        metrics.recordTick(1, 4);

        var timer = registry.find("coordinator.scheduler.tick.duration").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
        var summary = registry.find("coordinator.scheduler.assignments").summary();
        assertNotNull(summary);
        assertEquals(4.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordTaskOutcome increments the tagged counter")
    void outcomes() {
        metrics.recordTaskOutcome("completed");
        metrics.recordTaskOutcome("completed");
        metrics.recordTaskOutcome("retry");

        assertEquals(2.0, registry.find("coordinator.tasks.outcomes").tag("outcome", "completed").counter().count());
        assertEquals(1.0, registry.find("coordinator.tasks.outcomes").tag("outcome", "retry").counter().count());
        assertNull(registry.find("coordinator.tasks.outcomes").tag("outcome", "failed").counter());
    }

    @Test
    @DisplayName("recordTaskExecution records by role tag")
    void taskExecution() {
        metrics.recordTaskExecution("backend_developer", 5000);
        var timer = registry.find("coordinator.task.duration").tag("role", "backend_developer").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("simple counters increment")
    void simpleCounters() {
        metrics.recordTaskCreated("HIGH");
        metrics.recordTimeout();
        metrics.recordMessagePosted();
        metrics.recordEventDelivery(false);

        assertEquals(1.0, registry.find("coordinator.tasks.created").tag("priority", "HIGH").counter().count());
        assertEquals(1.0, registry.find("coordinator.tasks.timeouts").counter().count());
        assertEquals(1.0, registry.find("coordinator.messages.posted").counter().count());
        assertEquals(1.0, registry.find("coordinator.observability.deliveries").tag("success", "false").counter().count());
    }
}
