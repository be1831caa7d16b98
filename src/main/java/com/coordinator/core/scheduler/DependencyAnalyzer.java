package com.coordinator.core.scheduler;

import com.coordinator.core.model.Task;
import com.coordinator.core.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves task readiness against the full task map and finds dependencies that can never complete.
 */
@Component
public class DependencyAnalyzer {

    /**
     * A task is ready when it is PENDING and every dependency maps to a COMPLETED task.
     */
    public boolean isReady(Task task, Map<String, Task> allTasks) {
        return task.status() == TaskStatus.PENDING && unmetDependencies(task, allTasks).isEmpty();
    }

    /**
     * Dependency ids of {@code task} that are missing or not COMPLETED, in declaration order.
     */
    public Set<String> unmetDependencies(Task task, Map<String, Task> allTasks) {
        var unmet = new LinkedHashSet<String>();
        for (String dep : task.dependencies()) {
            Task depTask = allTasks.get(dep);
            if (depTask == null || depTask.status() != TaskStatus.COMPLETED) {
                unmet.add(dep);
            }
        }
        return unmet;
    }

    /**
     * Every PENDING task with unmet dependencies, flagged unsatisfiable when a dependency is
     * missing, FAILED or CANCELLED, lies on a cycle, or transitively depends on such a task.
     */
    public List<BlockedTask> blockedTasks(Map<String, Task> allTasks) {
        var memo = new HashMap<String, Optional<String>>();
        var result = new ArrayList<BlockedTask>();
        for (Task task : allTasks.values()) {
            if (task.status() != TaskStatus.PENDING) continue;
            Set<String> unmet = unmetDependencies(task, allTasks);
            if (unmet.isEmpty()) continue;
            Optional<String> reason = blockReason(task.id(), allTasks, memo, new HashSet<>());
            result.add(new BlockedTask(task.id(), unmet, reason.isPresent(), reason.orElse(null)));
        }
        return result;
    }

    private Optional<String> blockReason(String taskId, Map<String, Task> allTasks,
                                         Map<String, Optional<String>> memo, Set<String> visiting) {
        Optional<String> known = memo.get(taskId);
        if (known != null) return known;
        if (visiting.contains(taskId)) {
            return Optional.of("dependency cycle through " + taskId);
        }

        Task task = allTasks.get(taskId);
        visiting.add(taskId);
        Optional<String> reason = Optional.empty();
        for (String dep : new TreeSet<>(task.dependencies())) {
            Task depTask = allTasks.get(dep);
            if (depTask == null) {
                reason = Optional.of("missing dependency " + dep);
                break;
            }
            if (depTask.status() == TaskStatus.COMPLETED) continue;
            if (depTask.status() == TaskStatus.FAILED || depTask.status() == TaskStatus.CANCELLED) {
                reason = Optional.of("dependency " + dep + " is " + depTask.status());
                break;
            }
            Optional<String> nested = blockReason(dep, allTasks, memo, visiting);
            if (nested.isPresent()) {
                reason = nested;
                break;
            }
        }
        visiting.remove(taskId);
        memo.put(taskId, reason);
        return reason;
    }
}
