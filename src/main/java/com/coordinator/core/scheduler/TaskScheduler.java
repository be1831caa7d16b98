package com.coordinator.core.scheduler;

import com.coordinator.core.model.Agent;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.model.Task;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.core.registry.AgentRegistry;
import com.coordinator.core.task.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Matches ready tasks to idle, capable agents.
 * <p>
 * Ready tasks are visited in {@link TaskOrdering#READY_ORDER}. Each task takes the
 * longest-idle agent whose capabilities cover the task's requirements. A task with no
 * capable idle agent stays PENDING and is reconsidered on the next tick; lower-priority
 * tasks behind it may still be matched to other agents.
 * <p>
 * Callers must serialize ticks with every other mutation of the store and registry.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final TaskStore taskStore;
    private final AgentRegistry agentRegistry;
    private final DependencyAnalyzer dependencyAnalyzer;

    public TaskScheduler(TaskStore taskStore, AgentRegistry agentRegistry, DependencyAnalyzer dependencyAnalyzer) {
        this.taskStore = taskStore;
        this.agentRegistry = agentRegistry;
        this.dependencyAnalyzer = dependencyAnalyzer;
    }

    /**
     * Ready tasks in scheduling order.
     */
    public List<Task> readyTasks() {
        Map<String, Task> all = taskStore.snapshot();
        return all.values().stream()
                .filter(t -> dependencyAnalyzer.isReady(t, all))
                .sorted(TaskOrdering.READY_ORDER)
                .toList();
    }

    /**
     * Runs one scheduling pass.
     *
     * @param maxBusyAgents cap on agents holding a task (WORKING or WAITING) at once
     * @param now           timestamp recorded on the assignments
     */
    public TickResult tick(int maxBusyAgents, Instant now) {
        List<Task> ready = readyTasks();
        if (ready.isEmpty()) {
            return TickResult.empty(taskStore.countByStatus(TaskStatus.PENDING));
        }

        int busy = agentRegistry.countByStatus(AgentStatus.WORKING) + agentRegistry.countByStatus(AgentStatus.WAITING);
        var assignments = new ArrayList<Assignment>();

        for (Task task : ready) {
            if (busy >= maxBusyAgents) {
                log.debug("Busy agent limit {} reached, deferring remaining {} ready task(s)",
                        maxBusyAgents, ready.size() - assignments.size());
                break;
            }
            List<Agent> candidates = agentRegistry.findIdleWithCapabilities(task.requiredCapabilities());
            if (candidates.isEmpty()) {
                log.debug("  {} [{}] no idle agent with {}", task.id(), task.priority(), task.requiredCapabilities());
                continue;
            }
            Agent agent = candidates.get(0);
            agentRegistry.transition(agent.id(), AgentStatus.WORKING, task.id(), now);
            taskStore.update(task.id(), t -> t.withAssignment(agent.id(), now));
            assignments.add(new Assignment(task.id(), agent.id()));
            busy++;
            log.info("Assigned task {} [{}] '{}' to agent {}", task.id(), task.priority(), task.title(), agent.id());
        }

        return new TickResult(List.copyOf(assignments), ready.size(), taskStore.countByStatus(TaskStatus.PENDING));
    }
}
