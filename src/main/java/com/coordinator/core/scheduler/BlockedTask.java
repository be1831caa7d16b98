package com.coordinator.core.scheduler;

import java.util.Set;

/**
 * A PENDING task that cannot be scheduled yet.
 *
 * @param taskId        the blocked task
 * @param unmet         dependency ids not yet COMPLETED
 * @param unsatisfiable true when no sequence of completions can ever make the task ready
 * @param reason        why the task is unsatisfiable (missing id, failed dependency, cycle); null otherwise
 */
public record BlockedTask(
    String taskId,
    Set<String> unmet,
    boolean unsatisfiable,
    String reason
) {}
