package com.coordinator.core.health;

import com.coordinator.core.engine.CoordinationLoop;
import com.coordinator.core.engine.MultiAgentCoordinator;
import com.coordinator.core.events.HttpEventForwarder;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.model.CoordinatorStatus;
import com.coordinator.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final MultiAgentCoordinator coordinator;
    private final CoordinationLoop coordinationLoop;
    private final HttpEventForwarder eventForwarder;

    public HealthCheckService(
            @Autowired(required = false) MultiAgentCoordinator coordinator,
            @Autowired(required = false) CoordinationLoop coordinationLoop,
            @Autowired(required = false) HttpEventForwarder eventForwarder) {
        this.coordinator = coordinator;
        this.coordinationLoop = coordinationLoop;
        this.eventForwarder = eventForwarder;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRegistry());
        results.add(checkLoop());
        results.add(checkObservability());
        return results;
    }

    private HealthStatus checkRegistry() {
        if (coordinator == null) {
            return new HealthStatus("registry", HealthStatus.Status.DOWN,
                    "Coordinator not available", Map.of());
        }
        try {
            CoordinatorStatus status = coordinator.status();
            long idle = status.agents().stream().filter(a -> a.status() == AgentStatus.IDLE).count();
            long errored = status.agents().stream().filter(a -> a.status() == AgentStatus.ERROR).count();
            long failed = status.tasks().stream().filter(t -> t.status() == TaskStatus.FAILED).count();
            var metadata = Map.of(
                    "agents", String.valueOf(status.agents().size()),
                    "idle", String.valueOf(idle),
                    "tasks", String.valueOf(status.tasks().size()),
                    "pending", String.valueOf(status.queueSize()),
                    "failed", String.valueOf(failed));
            if (errored > 0) {
                return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                        errored + " agent(s) in ERROR", metadata);
            }
            return new HealthStatus("registry", HealthStatus.Status.UP,
                    status.agents().size() + " agent(s), " + status.queueSize() + " pending task(s)", metadata);
        } catch (Exception e) {
            log.warn("Registry health check failed: {}", e.getMessage());
            return new HealthStatus("registry", HealthStatus.Status.DOWN,
                    "Registry error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkLoop() {
        if (coordinationLoop == null || !coordinationLoop.isRunning()) {
            return new HealthStatus("coordination-loop", HealthStatus.Status.DOWN,
                    "Coordination loop not running", Map.of());
        }
        return new HealthStatus("coordination-loop", HealthStatus.Status.UP,
                "Coordination loop running", Map.of());
    }

    private HealthStatus checkObservability() {
        if (eventForwarder == null) {
            return new HealthStatus("observability", HealthStatus.Status.DEGRADED,
                    "Event forwarding disabled", Map.of());
        }
        return new HealthStatus("observability", HealthStatus.Status.UP,
                "Forwarding events to " + eventForwarder.getEndpoint(),
                Map.of("endpoint", eventForwarder.getEndpoint().toString()));
    }
}
