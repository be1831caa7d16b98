package com.coordinator.core.model;

import java.util.List;

/**
 * Read-only snapshot of the coordinator.
 *
 * @param agents       every registered agent
 * @param tasks        every task, in creation order
 * @param queueSize    number of PENDING tasks
 * @param messageCount messages currently retained by the message bus
 * @param running      whether the background coordination loop is active
 */
public record CoordinatorStatus(
    List<Agent> agents,
    List<Task> tasks,
    int queueSize,
    int messageCount,
    boolean running
) {}
