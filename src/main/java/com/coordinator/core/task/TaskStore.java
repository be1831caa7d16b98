package com.coordinator.core.task;

import com.coordinator.core.InvalidTransitionException;
import com.coordinator.core.TaskNotFoundException;
import com.coordinator.core.model.Task;
import com.coordinator.core.model.TaskPriority;
import com.coordinator.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Owns task records and enforces the {@link TaskStatus} state machine.
 * <p>
 * Records are kept in insertion order and never removed. Each method is atomic on its own;
 * operations that must also touch the agent registry are serialized by the coordinator.
 */
@Component
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private long nextSequence = 0;

    /**
     * Creates a PENDING task with a generated id and the next insertion sequence.
     */
    public synchronized Task create(String title, String description, TaskPriority priority,
                                    Set<String> dependencies, Set<String> requiredCapabilities,
                                    Instant now) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        if (priority == null) {
            throw new IllegalArgumentException("Task priority is required");
        }
        String id = "TASK-" + UUID.randomUUID();
        Task task = Task.pending(id, title, description, priority,
                dependencies, requiredCapabilities, now, nextSequence++);
        tasks.put(id, task);
        log.debug("Stored task {} (seq={}, deps={})", id, task.sequence(), task.dependencies());
        return task;
    }

    public synchronized Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public synchronized Task get(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    /**
     * Applies {@code change} to the stored task. If the status changes, the edge must be
     * allowed by {@link TaskStatus#canTransitionTo}; otherwise the record is left untouched.
     */
    public synchronized Task update(String taskId, UnaryOperator<Task> change) {
        Task current = get(taskId);
        Task updated = change.apply(current);
        if (updated.status() != current.status() && !current.status().canTransitionTo(updated.status())) {
            throw new InvalidTransitionException("Task", taskId, current.status(), updated.status());
        }
        tasks.put(taskId, updated);
        return updated;
    }

    /**
     * Fails fast with {@link InvalidTransitionException} if {@code taskId} cannot move to {@code target}.
     */
    public synchronized Task requireTransition(String taskId, TaskStatus target) {
        Task current = get(taskId);
        if (!current.status().canTransitionTo(target)) {
            throw new InvalidTransitionException("Task", taskId, current.status(), target);
        }
        return current;
    }

    public synchronized List<Task> list() {
        return new ArrayList<>(tasks.values());
    }

    public synchronized List<Task> withStatus(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).toList();
    }

    public synchronized int countByStatus(TaskStatus status) {
        return (int) tasks.values().stream().filter(t -> t.status() == status).count();
    }

    /** Lookup of every task by id, for dependency resolution. */
    public synchronized Map<String, Task> snapshot() {
        return new LinkedHashMap<>(tasks);
    }

    public synchronized int size() {
        return tasks.size();
    }
}
