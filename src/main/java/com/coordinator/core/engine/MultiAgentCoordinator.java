package com.coordinator.core.engine;

import com.coordinator.core.InvalidTransitionException;
import com.coordinator.core.config.CoordinatorProperties;
import com.coordinator.core.events.ObservabilityNotifier;
import com.coordinator.core.logging.MdcContext;
import com.coordinator.core.messaging.MessageBus;
import com.coordinator.core.metrics.CoordinatorMetrics;
import com.coordinator.core.model.Agent;
import com.coordinator.core.model.AgentMessage;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.model.AgentTemplate;
import com.coordinator.core.model.CoordinatorStatus;
import com.coordinator.core.model.Task;
import com.coordinator.core.model.TaskPriority;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.core.registry.AgentRegistry;
import com.coordinator.core.scheduler.Assignment;
import com.coordinator.core.scheduler.BlockedTask;
import com.coordinator.core.scheduler.DependencyAnalyzer;
import com.coordinator.core.scheduler.TaskScheduler;
import com.coordinator.core.scheduler.TickResult;
import com.coordinator.core.task.TaskStore;
import com.coordinator.core.template.AgentTemplateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the coordination engine.
 * <p>
 * Every mutating operation runs under one lock, so a task and the agent bound to it always
 * change together: no caller can observe a task ASSIGNED to an agent that is not WORKING on it.
 * Lifecycle events are collected while the lock is held and handed to the
 * {@link ObservabilityNotifier} only after it is released.
 * <p>
 * When {@code coordinator.auto-assign-tasks} is on, a scheduling tick runs at the end of each
 * mutation that can make a task ready or an agent idle.
 */
@Service
public class MultiAgentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MultiAgentCoordinator.class);

    private final TaskStore taskStore;
    private final AgentRegistry agentRegistry;
    private final TaskScheduler scheduler;
    private final DependencyAnalyzer dependencyAnalyzer;
    private final MessageBus messageBus;
    private final ObservabilityNotifier notifier;
    private final AgentTemplateProvider templateProvider;
    private final CoordinatorProperties properties;
    private final CoordinatorMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicLong tickCounter = new AtomicLong();
    private volatile boolean running;

    public MultiAgentCoordinator(TaskStore taskStore,
                                 AgentRegistry agentRegistry,
                                 TaskScheduler scheduler,
                                 DependencyAnalyzer dependencyAnalyzer,
                                 MessageBus messageBus,
                                 ObservabilityNotifier notifier,
                                 AgentTemplateProvider templateProvider,
                                 CoordinatorProperties properties,
                                 @Autowired(required = false) CoordinatorMetrics metrics,
                                 Clock clock) {
        this.taskStore = taskStore;
        this.agentRegistry = agentRegistry;
        this.scheduler = scheduler;
        this.dependencyAnalyzer = dependencyAnalyzer;
        this.messageBus = messageBus;
        this.notifier = notifier;
        this.templateProvider = templateProvider;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    // -- Agents ---------------------------------------------------------------

    /**
     * Registers an agent in IDLE state.
     *
     * @throws com.coordinator.core.DuplicateAgentException if the id is taken
     */
    public Agent registerAgent(Agent agent) {
        return mutate(true, events -> {
            Agent registered = agentRegistry.register(agent, clock.instant());
            MdcContext.setAgent(registered.id());
            events.add(new PendingEvent("agent_registered", EventPayloads.agentRegistered(registered)));
            if (metrics != null) metrics.recordAgentRegistered(registered.role());
            return registered;
        });
    }

    /**
     * Builds an agent from the template provider and registers it.
     *
     * @throws com.coordinator.core.UnknownRoleException if the role is not defined
     */
    public Agent registerFromTemplate(String roleId, String instanceId, String projectPath) {
        AgentTemplate template = templateProvider.create(roleId, instanceId, projectPath);
        return registerAgent(Agent.fromTemplate(template));
    }

    /**
     * Requests an agent status change.
     * <ul>
     *   <li>WAITING: the agent is blocked on external input ({@link #blockAgent})</li>
     *   <li>WORKING: the agent resumes its task ({@link #unblockAgent})</li>
     *   <li>IDLE: the agent recovers from ERROR or COMPLETED ({@link #resetAgent})</li>
     *   <li>ERROR: the agent faulted; its task is failed and the agent stays in ERROR</li>
     * </ul>
     * Assignment to WORKING from IDLE happens only through the scheduler, and COMPLETED
     * only through {@link #completeTask}.
     */
    public Agent transitionAgent(String agentId, AgentStatus target) {
        return switch (target) {
            case WAITING -> blockAgent(agentId);
            case WORKING -> unblockAgent(agentId);
            case IDLE -> resetAgent(agentId);
            case ERROR -> reportAgentError(agentId, "Agent reported error");
            case COMPLETED -> throw new IllegalArgumentException(
                    "Agent completion is reported through completeTask for the agent's current task");
        };
    }

    public Agent blockAgent(String agentId) {
        return mutate(false, events -> {
            MdcContext.setAgent(agentId);
            return transitionRecorded(agentId, AgentStatus.WAITING, null, clock.instant(), events);
        });
    }

    public Agent unblockAgent(String agentId) {
        return mutate(false, events -> {
            MdcContext.setAgent(agentId);
            Agent agent = agentRegistry.get(agentId);
            if (agent.status() != AgentStatus.WAITING) {
                throw new InvalidTransitionException("Agent", agentId, agent.status(), AgentStatus.WORKING);
            }
            String taskId = activeTaskOf(agentId)
                    .orElseThrow(() -> new IllegalStateException("Waiting agent " + agentId + " holds no task"));
            return transitionRecorded(agentId, AgentStatus.WORKING, taskId, clock.instant(), events);
        });
    }

    public Agent resetAgent(String agentId) {
        return mutate(true, events -> {
            MdcContext.setAgent(agentId);
            return transitionRecorded(agentId, AgentStatus.IDLE, null, clock.instant(), events);
        });
    }

    /**
     * Marks an agent as faulted. The task it holds counts one failed attempt; the agent
     * stays in ERROR until {@link #resetAgent} is called.
     */
    public Agent reportAgentError(String agentId, String reason) {
        return mutate(true, events -> {
            MdcContext.setAgent(agentId);
            Agent agent = agentRegistry.get(agentId);
            if (agent.status() != AgentStatus.WORKING && agent.status() != AgentStatus.WAITING) {
                throw new InvalidTransitionException("Agent", agentId, agent.status(), AgentStatus.ERROR);
            }
            Optional<String> taskId = activeTaskOf(agentId);
            if (taskId.isPresent()) {
                failInternal(taskId.get(), reason, false, events);
            } else {
                transitionRecorded(agentId, AgentStatus.ERROR, null, clock.instant(), events);
            }
            return agentRegistry.get(agentId);
        });
    }

    // -- Tasks ----------------------------------------------------------------

    public Task createTask(String title, String description, TaskPriority priority, Set<String> dependencies) {
        return createTask(title, description, priority, dependencies, Set.of());
    }

    /**
     * Creates a PENDING task and enqueues it. Unknown dependency ids are accepted; the task
     * then shows up in {@link #blockedTasks()} as unsatisfiable.
     */
    public Task createTask(String title, String description, TaskPriority priority,
                           Set<String> dependencies, Set<String> requiredCapabilities) {
        return mutate(true, events -> {
            Task task = taskStore.create(title, description, priority,
                    dependencies, requiredCapabilities, clock.instant());
            MdcContext.setTask(task.id(), null);
            log.info("Created task: {} (Priority: {})", title, priority);
            events.add(new PendingEvent("task_created", EventPayloads.task(task)));
            if (metrics != null) metrics.recordTaskCreated(priority.name());
            return task;
        });
    }

    /**
     * Runs one scheduling tick on demand.
     */
    public TickResult scheduleTick() {
        return mutate(false, this::runTick);
    }

    /**
     * Worker report: the assigned agent started executing the task.
     */
    public Task startTask(String taskId) {
        return mutate(false, events -> {
            Task current = taskStore.requireTransition(taskId, TaskStatus.IN_PROGRESS);
            MdcContext.setTask(taskId, current.assignedAgent());
            Task started = taskStore.update(taskId, t -> t.withStatus(TaskStatus.IN_PROGRESS));
            events.add(new PendingEvent("task_started", EventPayloads.taskOutcome(started, started.assignedAgent())));
            return started;
        });
    }

    /**
     * Worker report: the task finished successfully. The agent goes back to IDLE.
     */
    public Task completeTask(String taskId, String result) {
        return mutate(true, events -> {
            Task current = taskStore.requireTransition(taskId, TaskStatus.COMPLETED);
            String agentId = current.assignedAgent();
            MdcContext.setTask(taskId, agentId);
            Instant now = clock.instant();

            Task completed = taskStore.update(taskId, t -> t.withCompletion(result, now));
            events.add(new PendingEvent("task_completed", EventPayloads.taskOutcome(completed, agentId)));
            log.info("Task {} completed by agent {}", taskId, agentId);

            String role = agentRegistry.find(agentId).map(Agent::role).orElse(null);
            releaseAgent(agentId, taskId, AgentStatus.COMPLETED, true, now, events);
            if (metrics != null) {
                metrics.recordTaskOutcome("completed");
                if (current.assignedAt() != null) {
                    metrics.recordTaskExecution(role, Duration.between(current.assignedAt(), now).toMillis());
                }
            }
            return completed;
        });
    }

    /**
     * Worker report: the attempt failed. The task is re-queued until
     * {@code coordinator.max-task-retries} attempts have failed, then it is FAILED for good.
     * The agent goes back to IDLE either way.
     */
    public Task failTask(String taskId, String error) {
        return mutate(true, events -> failInternal(taskId, error, true, events));
    }

    /**
     * Cancels a task. A PENDING task is cancelled immediately. A task held by an agent is only
     * flagged; the worker's completion or failure report closes it, with the timeout as fallback.
     */
    public Task cancelTask(String taskId) {
        return mutate(false, events -> {
            Task current = taskStore.get(taskId);
            MdcContext.setTask(taskId, current.assignedAgent());
            if (current.status() == TaskStatus.PENDING) {
                Task cancelled = taskStore.update(taskId, t -> t.withCancellation(clock.instant()));
                events.add(new PendingEvent("task_cancelled", EventPayloads.taskOutcome(cancelled, null)));
                if (metrics != null) metrics.recordTaskOutcome("cancelled");
                log.info("Task {} cancelled before assignment", taskId);
                return cancelled;
            }
            if (current.status().isActive()) {
                if (current.cancelRequested()) return current;
                Task flagged = taskStore.update(taskId, Task::withCancelRequested);
                events.add(new PendingEvent("task_cancel_requested",
                        EventPayloads.taskOutcome(flagged, flagged.assignedAgent())));
                log.info("Cancellation requested for task {} held by agent {}", taskId, current.assignedAgent());
                return flagged;
            }
            throw new InvalidTransitionException("Task", taskId, current.status(), TaskStatus.CANCELLED);
        });
    }

    /**
     * Fails every ASSIGNED or IN_PROGRESS task held for longer than the configured timeout.
     *
     * @return ids of the expired tasks
     */
    public List<String> expireTimedOutTasks() {
        return mutate(true, events -> {
            Instant now = clock.instant();
            int minutes = properties.getTaskTimeoutMinutes();
            Duration timeout = properties.getTaskTimeout();
            var expired = new ArrayList<String>();
            for (Task task : taskStore.list()) {
                if (!task.status().isActive() || task.assignedAt() == null) continue;
                if (!now.isAfter(task.assignedAt().plus(timeout))) continue;

                expired.add(task.id());
                MdcContext.setTask(task.id(), task.assignedAgent());
                log.warn("Task {} exceeded timeout of {} minutes on agent {}", task.id(), minutes, task.assignedAgent());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("task_id", task.id());
                payload.put("agent_id", task.assignedAgent());
                payload.put("timeout_minutes", minutes);
                events.add(new PendingEvent("task_timeout", payload));
                if (metrics != null) metrics.recordTimeout();
                failInternal(task.id(), "Task timed out after " + minutes + " minutes", true, events);
            }
            return expired;
        });
    }

    // -- Messages -------------------------------------------------------------

    public AgentMessage postMessage(String fromAgent, String toAgent, String messageType,
                                   String content, String taskId) {
        return mutate(false, events -> {
            AgentMessage message = messageBus.post(fromAgent, toAgent, messageType, content, taskId);
            events.add(new PendingEvent("message_posted", EventPayloads.message(message)));
            if (metrics != null) metrics.recordMessagePosted();
            return message;
        });
    }

    public Iterable<AgentMessage> messagesSince(String agentId, Instant since) {
        return messageBus.since(agentId, since);
    }

    // -- Queries --------------------------------------------------------------

    /**
     * Consistent read-only snapshot. Never triggers a scheduling tick.
     */
    public CoordinatorStatus status() {
        lock.lock();
        try {
            return new CoordinatorStatus(
                    agentRegistry.list(),
                    taskStore.list(),
                    taskStore.countByStatus(TaskStatus.PENDING),
                    messageBus.size(),
                    running);
        } finally {
            lock.unlock();
        }
    }

    public Task getTask(String taskId) {
        return taskStore.get(taskId);
    }

    public Agent getAgent(String agentId) {
        return agentRegistry.get(agentId);
    }

    public List<Task> listTasks() {
        return taskStore.list();
    }

    public List<Agent> listAgents() {
        return agentRegistry.list();
    }

    public List<Task> readyTasks() {
        return scheduler.readyTasks();
    }

    public Set<String> unmetDependencies(String taskId) {
        Task task = taskStore.get(taskId);
        return dependencyAnalyzer.unmetDependencies(task, taskStore.snapshot());
    }

    /**
     * PENDING tasks waiting on dependencies, with those that can never run flagged.
     */
    public List<BlockedTask> blockedTasks() {
        return dependencyAnalyzer.blockedTasks(taskStore.snapshot());
    }

    public boolean isRunning() {
        return running;
    }

    void setRunning(boolean running) {
        this.running = running;
    }

    // -- Internals ------------------------------------------------------------

    private TickResult runTick(List<PendingEvent> events) {
        long tick = tickCounter.incrementAndGet();
        MdcContext.setTick(tick);
        long start = System.nanoTime();

        TickResult result = scheduler.tick(properties.getMaxConcurrentAgents(), clock.instant());
        for (Assignment assignment : result.assignments()) {
            Task task = taskStore.get(assignment.taskId());
            Agent agent = agentRegistry.get(assignment.agentId());
            events.add(new PendingEvent("task_assigned", EventPayloads.taskAssigned(task, agent)));
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (metrics != null) metrics.recordTick(result.assignments().size(), elapsedMs);
        if (!result.assignments().isEmpty()) {
            log.info("Tick {}: assigned {} of {} ready task(s), {} still pending",
                    tick, result.assignments().size(), result.readyCount(), result.pendingCount());
        }
        return result;
    }

    private Task failInternal(String taskId, String error, boolean settleAgentIdle, List<PendingEvent> events) {
        Task current = taskStore.requireTransition(taskId, TaskStatus.FAILED);
        String agentId = current.assignedAgent();
        MdcContext.setTask(taskId, agentId);
        Instant now = clock.instant();

        int attempts = current.retryCount() + 1;
        int maxRetries = properties.getMaxTaskRetries();
        boolean retry = !current.cancelRequested() && attempts < maxRetries;
        TaskStatus terminal = current.cancelRequested() ? TaskStatus.CANCELLED : TaskStatus.FAILED;
        Task updated = taskStore.update(taskId, t -> t.withFailure(error, retry, terminal, now));

        String eventType;
        if (retry) {
            eventType = "task_retry";
            log.warn("Task {} failed (attempt {}/{}), re-queued: {}", taskId, attempts, maxRetries, error);
        } else if (terminal == TaskStatus.CANCELLED) {
            eventType = "task_cancelled";
            log.info("Task {} stopped after cancellation request: {}", taskId, error);
        } else {
            eventType = "task_failed";
            log.error("Task {} failed permanently after {} attempt(s): {}", taskId, attempts, error);
        }
        events.add(new PendingEvent(eventType, EventPayloads.taskOutcome(updated, agentId)));
        if (metrics != null) metrics.recordTaskOutcome(retry ? "retry" : terminal.name().toLowerCase());

        releaseAgent(agentId, taskId, AgentStatus.ERROR, settleAgentIdle, now, events);
        return updated;
    }

    /**
     * Unbinds the agent that held {@code taskId}: WAITING resumes to WORKING first, then the
     * agent passes through {@code via} (COMPLETED or ERROR) and optionally settles in IDLE.
     */
    private void releaseAgent(String agentId, String taskId, AgentStatus via, boolean settleIdle,
                              Instant now, List<PendingEvent> events) {
        if (agentId == null) return;
        Agent agent = agentRegistry.find(agentId).orElse(null);
        if (agent == null) {
            log.warn("Task {} was held by unknown agent {}", taskId, agentId);
            return;
        }
        if (agent.status() == AgentStatus.WAITING) {
            agent = transitionRecorded(agentId, AgentStatus.WORKING, taskId, now, events);
        }
        if (agent.status() != AgentStatus.WORKING) {
            log.warn("Agent {} is {} while releasing task {}", agentId, agent.status(), taskId);
            return;
        }
        transitionRecorded(agentId, via, null, now, events);
        if (settleIdle) {
            transitionRecorded(agentId, AgentStatus.IDLE, null, now, events);
        }
    }

    private Agent transitionRecorded(String agentId, AgentStatus target, String taskId,
                                     Instant now, List<PendingEvent> events) {
        Agent before = agentRegistry.get(agentId);
        Agent after = agentRegistry.transition(agentId, target, taskId, now);
        events.add(new PendingEvent("agent_status_changed", EventPayloads.agentStatusChanged(before, after)));
        return after;
    }

    private Optional<String> activeTaskOf(String agentId) {
        return taskStore.list().stream()
                .filter(t -> t.status().isActive() && agentId.equals(t.assignedAgent()))
                .map(Task::id)
                .findFirst();
    }

    private <T> T mutate(boolean reschedule, Mutation<T> mutation) {
        List<PendingEvent> events = new ArrayList<>();
        T result;
        lock.lock();
        try {
            result = mutation.apply(events);
            if (reschedule && properties.isAutoAssignTasks()) {
                runTick(events);
            }
        } finally {
            lock.unlock();
            MdcContext.clear();
        }
        publish(events);
        return result;
    }

    private void publish(List<PendingEvent> events) {
        for (PendingEvent event : events) {
            try {
                notifier.notify(event.type(), event.payload());
            } catch (Exception e) {
                log.warn("Notifier failed for event {}: {}", event.type(), e.getMessage());
            }
        }
    }

    @FunctionalInterface
    private interface Mutation<T> {
        T apply(List<PendingEvent> events);
    }

    private record PendingEvent(String type, Map<String, Object> payload) {}
}
