package com.coordinator.dispatch.api;

import com.coordinator.core.AgentNotFoundException;
import com.coordinator.core.DuplicateAgentException;
import com.coordinator.core.InvalidTransitionException;
import com.coordinator.core.UnknownRoleException;
import com.coordinator.core.engine.MultiAgentCoordinator;
import com.coordinator.core.model.Agent;
import com.coordinator.core.model.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for agent registration and status reports.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final MultiAgentCoordinator coordinator;

    public AgentController(MultiAgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * POST /api/v1/agents: Register an agent, either explicitly or from a role template.
     */
    @PostMapping
    public ResponseEntity<?> register(@RequestBody AgentRequest request) {
        if (request.id() == null || request.id().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Agent id is required"));
        }
        try {
            Agent registered;
            if (request.roleTemplate() != null && !request.roleTemplate().isBlank()) {
                registered = coordinator.registerFromTemplate(
                        request.roleTemplate(), request.id(), request.projectPath());
            } else {
                registered = coordinator.registerAgent(new Agent(
                        request.id(),
                        request.name() != null ? request.name() : request.id(),
                        request.role(),
                        request.capabilities() != null ? new LinkedHashSet<>(request.capabilities()) : null,
                        AgentStatus.IDLE,
                        null,
                        request.projectPath(),
                        request.maxConcurrentTasks() != null ? request.maxConcurrentTasks() : 1,
                        request.prompt(),
                        null,
                        0));
            }
            return ResponseEntity.status(HttpStatus.CREATED).body(AgentResponse.from(registered));
        } catch (DuplicateAgentException e) {
            log.warn("Rejected duplicate agent registration: {}", request.id());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (UnknownRoleException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/agents: List all registered agents.
     */
    @GetMapping
    public ResponseEntity<List<AgentResponse>> list() {
        return ResponseEntity.ok(coordinator.listAgents().stream().map(AgentResponse::from).toList());
    }

    /**
     * GET /api/v1/agents/{id}: Get one agent.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return respond(() -> coordinator.getAgent(id));
    }

    /**
     * POST /api/v1/agents/{id}/transition: Request a status change, body {@code {"status": "idle"}}.
     */
    @PostMapping("/{id}/transition")
    public ResponseEntity<?> transition(@PathVariable String id, @RequestBody Map<String, String> body) {
        AgentStatus target;
        try {
            target = AgentStatus.valueOf(String.valueOf(body.get("status")).toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid status: " + body.get("status")));
        }
        return respond(() -> coordinator.transitionAgent(id, target));
    }

    /**
     * POST /api/v1/agents/{id}/block: Agent is waiting on external input.
     */
    @PostMapping("/{id}/block")
    public ResponseEntity<?> block(@PathVariable String id) {
        return respond(() -> coordinator.blockAgent(id));
    }

    /**
     * POST /api/v1/agents/{id}/unblock: Agent resumes its task.
     */
    @PostMapping("/{id}/unblock")
    public ResponseEntity<?> unblock(@PathVariable String id) {
        return respond(() -> coordinator.unblockAgent(id));
    }

    private ResponseEntity<?> respond(Supplier<Agent> action) {
        try {
            return ResponseEntity.ok(AgentResponse.from(action.get()));
        } catch (AgentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
