package com.coordinator.dispatch.api;

import com.coordinator.core.engine.MultiAgentCoordinator;
import com.coordinator.core.model.CoordinatorStatus;
import com.coordinator.core.scheduler.TickResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for the coordinator snapshot and on-demand scheduling.
 */
@RestController
@RequestMapping("/api/v1")
public class StatusController {

    private final MultiAgentCoordinator coordinator;

    public StatusController(MultiAgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * GET /api/v1/status: Read-only snapshot; never schedules.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        CoordinatorStatus status = coordinator.status();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agents", status.agents().stream().map(AgentResponse::from).toList());
        body.put("tasks", status.tasks().stream()
                .map(t -> TaskResponse.from(t, coordinator.unmetDependencies(t.id())))
                .toList());
        body.put("queue_size", status.queueSize());
        body.put("message_count", status.messageCount());
        body.put("running", status.running());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/schedule: Run one scheduling tick now.
     */
    @PostMapping("/schedule")
    public ResponseEntity<TickResult> schedule() {
        return ResponseEntity.ok(coordinator.scheduleTick());
    }
}
