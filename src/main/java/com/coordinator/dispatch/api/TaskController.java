package com.coordinator.dispatch.api;

import com.coordinator.core.InvalidTransitionException;
import com.coordinator.core.TaskNotFoundException;
import com.coordinator.core.engine.MultiAgentCoordinator;
import com.coordinator.core.model.Task;
import com.coordinator.core.model.TaskPriority;
import com.coordinator.core.scheduler.BlockedTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * REST controller for the task queue and worker lifecycle reports.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final MultiAgentCoordinator coordinator;

    public TaskController(MultiAgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * POST /api/v1/tasks: Create and enqueue a task.
     */
    @PostMapping
    public ResponseEntity<?> create(@RequestBody TaskRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Task title is required"));
        }
        TaskPriority priority;
        try {
            priority = parsePriority(request.priority());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid priority: " + request.priority()));
        }
        Task task = coordinator.createTask(
                request.title(),
                request.description(),
                priority,
                toSet(request.dependencies()),
                toSet(request.requiredCapabilities()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(task));
    }

    /**
     * GET /api/v1/tasks: List all tasks in creation order.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> list() {
        return ResponseEntity.ok(coordinator.listTasks().stream().map(this::toResponse).toList());
    }

    /**
     * GET /api/v1/tasks/blocked: PENDING tasks waiting on dependencies.
     */
    @GetMapping("/blocked")
    public ResponseEntity<List<BlockedTask>> blocked() {
        return ResponseEntity.ok(coordinator.blockedTasks());
    }

    /**
     * GET /api/v1/tasks/{id}: Get one task with its unmet dependencies.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return respond(() -> coordinator.getTask(id));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<?> start(@PathVariable String id) {
        return respond(() -> coordinator.startTask(id));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<?> complete(@PathVariable String id,
                                      @RequestBody(required = false) TaskOutcomeRequest body) {
        String result = body != null ? body.result() : null;
        return respond(() -> coordinator.completeTask(id, result));
    }

    @PostMapping("/{id}/fail")
    public ResponseEntity<?> fail(@PathVariable String id,
                                  @RequestBody(required = false) TaskOutcomeRequest body) {
        String error = body != null && body.error() != null ? body.error() : "Task failed";
        log.debug("Failure reported for task {}: {}", id, error);
        return respond(() -> coordinator.failTask(id, error));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        return respond(() -> coordinator.cancelTask(id));
    }

    static TaskPriority parsePriority(String value) {
        if (value == null || value.isBlank()) {
            return TaskPriority.MEDIUM;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return TaskPriority.fromLevel(Integer.parseInt(trimmed));
        }
        return TaskPriority.valueOf(trimmed.toUpperCase());
    }

    private ResponseEntity<?> respond(Supplier<Task> action) {
        try {
            return ResponseEntity.ok(toResponse(action.get()));
        } catch (TaskNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    private TaskResponse toResponse(Task task) {
        return TaskResponse.from(task, coordinator.unmetDependencies(task.id()));
    }

    private static Set<String> toSet(List<String> values) {
        return values != null ? new LinkedHashSet<>(values) : Set.of();
    }
}
