package com.coordinator.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task scheduling and agent lifecycle.
 */
@Service
public class CoordinatorMetrics {

    private final MeterRegistry registry;

    public CoordinatorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAgentRegistered(String role) {
        Counter.builder("coordinator.agents.registered")
                .tag("role", role != null ? role : "unknown")
                .register(registry)
                .increment();
    }

    public void recordTaskCreated(String priority) {
        Counter.builder("coordinator.tasks.created")
                .tag("priority", priority)
                .register(registry)
                .increment();
    }

    /**
     * Records a scheduling tick.
     *
     * @param assignments number of tasks matched in the tick
     * @param ms          tick duration in milliseconds
     */
    public void recordTick(int assignments, long ms) {
        Timer.builder("coordinator.scheduler.tick.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("coordinator.scheduler.assignments")
                .description("Tasks assigned per scheduling tick")
                .register(registry)
                .record(assignments);
    }

    /**
     * Records a terminal or retried task outcome.
     *
     * @param outcome "completed", "retry", "failed" or "cancelled"
     */
    public void recordTaskOutcome(String outcome) {
        Counter.builder("coordinator.tasks.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String role, long ms) {
        Timer.builder("coordinator.task.duration")
                .tag("role", role != null ? role : "unknown")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTimeout() {
        Counter.builder("coordinator.tasks.timeouts")
                .description("Assignments that exceeded the task timeout")
                .register(registry)
                .increment();
    }

    public void recordMessagePosted() {
        Counter.builder("coordinator.messages.posted")
                .register(registry)
                .increment();
    }

    /**
     * Records an observability delivery attempt.
     *
     * @param success whether the collector accepted the event
     */
    public void recordEventDelivery(boolean success) {
        Counter.builder("coordinator.observability.deliveries")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
