package com.coordinator.core.engine;

import com.coordinator.core.config.CoordinatorProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that sweeps timed-out assignments and, when auto-assignment is on,
 * runs a scheduling tick every {@code coordinator.health-check-interval} seconds.
 * <p>
 * Runs on a single daemon thread. A failing iteration is logged and the loop carries on.
 * Disabled with {@code coordinator.loop.enabled=false}, which the one-shot CLI commands set.
 */
@Component
@ConditionalOnProperty(name = "coordinator.loop.enabled", havingValue = "true", matchIfMissing = true)
public class CoordinationLoop {

    private static final Logger log = LoggerFactory.getLogger(CoordinationLoop.class);

    private final MultiAgentCoordinator coordinator;
    private final CoordinatorProperties properties;

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "coordination-loop");
        t.setDaemon(true);
        return t;
    });

    public CoordinationLoop(MultiAgentCoordinator coordinator, CoordinatorProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        long interval = Math.max(1, properties.getHealthCheckInterval());
        executor.scheduleWithFixedDelay(this::runOnce, interval, interval, TimeUnit.SECONDS);
        coordinator.setRunning(true);
        log.info("Coordination loop started (interval={}s, autoAssign={})", interval, properties.isAutoAssignTasks());
    }

    @PreDestroy
    void stop() {
        coordinator.setRunning(false);
        executor.shutdownNow();
        log.info("Coordination loop stopped");
    }

    /**
     * One loop iteration: timeout sweep, then a tick if auto-assignment is enabled.
     */
    void runOnce() {
        try {
            List<String> expired = coordinator.expireTimedOutTasks();
            if (!expired.isEmpty()) {
                log.warn("Timed out {} task(s): {}", expired.size(), expired);
            }
            if (properties.isAutoAssignTasks()) {
                coordinator.scheduleTick();
            }
        } catch (Exception e) {
            log.error("Coordination loop iteration failed: {}", e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return coordinator.isRunning() && !executor.isShutdown();
    }
}
