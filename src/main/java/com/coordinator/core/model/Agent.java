package com.coordinator.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * A worker agent known to the registry.
 *
 * @param id                   unique agent identifier
 * @param name                 display name
 * @param role                 declared specialization (e.g. "backend_developer")
 * @param capabilities         capability tags the agent holds
 * @param status               current status
 * @param currentTask          task the agent works on; non-null iff status is WORKING
 * @param projectPath          working directory, opaque to the coordinator
 * @param maxConcurrentTasks   declared concurrency limit; stored but agents take one task at a time
 * @param prompt               role prompt handed to the worker process, opaque to the coordinator
 * @param lastActivity         time of the last status change
 * @param registrationSequence registration order, breaks ties in idle ordering
 */
public record Agent(
    String id,
    String name,
    String role,
    Set<String> capabilities,
    AgentStatus status,
    String currentTask,
    String projectPath,
    int maxConcurrentTasks,
    String prompt,
    Instant lastActivity,
    long registrationSequence
) implements Serializable {

    public Agent {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        if (maxConcurrentTasks < 1) maxConcurrentTasks = 1;
        if (projectPath == null) projectPath = ".";
    }

    public static Agent of(String id, String name, String role, Set<String> capabilities) {
        return new Agent(id, name, role, capabilities, AgentStatus.IDLE, null, ".", 1, null, null, 0);
    }

    public static Agent fromTemplate(AgentTemplate template) {
        return new Agent(template.id(), template.name(), template.role(), template.capabilities(),
                AgentStatus.IDLE, null, template.projectPath(), template.maxConcurrentTasks(),
                template.prompt(), null, 0);
    }

    public boolean hasCapabilities(Set<String> required) {
        return required == null || capabilities.containsAll(required);
    }

    /** Copy in IDLE state stamped with registration data. */
    public Agent registered(Instant now, long sequence) {
        return new Agent(id, name, role, capabilities, AgentStatus.IDLE, null, projectPath,
                maxConcurrentTasks, prompt, now, sequence);
    }

    public Agent withStatus(AgentStatus newStatus, String task, Instant now) {
        return new Agent(id, name, role, capabilities, newStatus, task, projectPath,
                maxConcurrentTasks, prompt, now, registrationSequence);
    }
}
