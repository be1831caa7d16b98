package com.coordinator.core.registry;

import com.coordinator.core.AgentNotFoundException;
import com.coordinator.core.DuplicateAgentException;
import com.coordinator.core.InvalidTransitionException;
import com.coordinator.core.model.Agent;
import com.coordinator.core.model.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns agent records, the capability index, and the {@link AgentStatus} state machine.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    /** Longest-idle first; registration order breaks ties. */
    static final Comparator<Agent> IDLE_ORDER = Comparator
            .comparing(Agent::lastActivity)
            .thenComparingLong(Agent::registrationSequence);

    private final Map<String, Agent> agents = new LinkedHashMap<>();

    /** capability tag -> ids of agents holding it */
    private final Map<String, Set<String>> capabilityIndex = new HashMap<>();

    private long nextSequence = 0;

    /**
     * Registers an agent in IDLE state.
     *
     * @throws DuplicateAgentException if the id is already registered; the registry is unchanged
     */
    public synchronized Agent register(Agent agent, Instant now) {
        if (agent.id() == null || agent.id().isBlank()) {
            throw new IllegalArgumentException("Agent id is required");
        }
        if (agents.containsKey(agent.id())) {
            throw new DuplicateAgentException(agent.id());
        }
        Agent registered = agent.registered(now, nextSequence++);
        agents.put(registered.id(), registered);
        for (String capability : registered.capabilities()) {
            capabilityIndex.computeIfAbsent(capability, k -> new HashSet<>()).add(registered.id());
        }
        log.info("Registered agent: {} ({}) with {} capabilities",
                registered.name(), registered.role(), registered.capabilities().size());
        return registered;
    }

    public synchronized Optional<Agent> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public synchronized Agent get(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new AgentNotFoundException(agentId);
        }
        return agent;
    }

    public synchronized List<Agent> list() {
        return new ArrayList<>(agents.values());
    }

    public synchronized int size() {
        return agents.size();
    }

    public synchronized int countByStatus(AgentStatus status) {
        return (int) agents.values().stream().filter(a -> a.status() == status).count();
    }

    /**
     * Idle agents whose capabilities are a superset of {@code required}, longest-idle first.
     */
    public synchronized List<Agent> findIdleWithCapabilities(Set<String> required) {
        List<Agent> candidates = new ArrayList<>();
        for (String id : candidateIds(required)) {
            Agent agent = agents.get(id);
            if (agent.status() == AgentStatus.IDLE && agent.hasCapabilities(required)) {
                candidates.add(agent);
            }
        }
        candidates.sort(IDLE_ORDER);
        return candidates;
    }

    /**
     * Moves an agent along an allowed edge. Entering WORKING binds {@code currentTask};
     * every other status clears it.
     *
     * @throws InvalidTransitionException if the edge is not allowed; the record is unchanged
     */
    public synchronized Agent transition(String agentId, AgentStatus newStatus, String currentTask, Instant now) {
        Agent current = get(agentId);
        if (!current.status().canTransitionTo(newStatus)) {
            throw new InvalidTransitionException("Agent", agentId, current.status(), newStatus);
        }
        if (newStatus == AgentStatus.WORKING && currentTask == null) {
            throw new IllegalArgumentException("Agent " + agentId + " cannot be WORKING without a current task");
        }
        Agent updated = current.withStatus(newStatus,
                newStatus == AgentStatus.WORKING ? currentTask : null, now);
        agents.put(agentId, updated);
        log.debug("Agent {} {} -> {} (task={})", agentId, current.status(), newStatus, updated.currentTask());
        return updated;
    }

    /** Narrows the scan to the rarest required capability. */
    private Set<String> candidateIds(Set<String> required) {
        if (required == null || required.isEmpty()) {
            return agents.keySet();
        }
        Set<String> smallest = null;
        for (String capability : required) {
            Set<String> holders = capabilityIndex.getOrDefault(capability, Set.of());
            if (smallest == null || holders.size() < smallest.size()) {
                smallest = holders;
            }
        }
        return smallest;
    }
}
