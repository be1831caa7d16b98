package com.coordinator.core.messaging;

import com.coordinator.core.config.CoordinatorProperties;
import com.coordinator.core.model.AgentMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of inter-agent messages with time-bounded retention.
 * <p>
 * The log is copy-on-write: readers iterate over the snapshot taken when they started,
 * so purging expired entries never disturbs an iteration in progress.
 */
@Component
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final CopyOnWriteArrayList<AgentMessage> messages = new CopyOnWriteArrayList<>();
    private final Duration retention;
    private final Clock clock;
    private long nextSequence = 1;

    @Autowired
    public MessageBus(CoordinatorProperties properties, Clock clock) {
        this(properties.getMessageRetention(), clock);
    }

    public MessageBus(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Appends a message stamped with the next sequence number and the current time.
     * Entries older than the retention window are purged first.
     */
    public synchronized AgentMessage post(String fromAgent, String toAgent, String messageType,
                                          String content, String taskId) {
        Objects.requireNonNull(toAgent, "toAgent");
        Instant now = clock.instant();
        purgeOlderThan(now.minus(retention));
        AgentMessage message = new AgentMessage(nextSequence++, "MSG-" + UUID.randomUUID(),
                fromAgent, toAgent, messageType, content, now, taskId);
        messages.add(message);
        log.debug("Message {} {} -> {} ({})", message.sequence(), fromAgent, toAgent, messageType);
        return message;
    }

    /**
     * Messages addressed to {@code agentId} with a timestamp at or after {@code since}, in append order.
     * <p>
     * The result is lazy and restartable: every {@code iterator()} call starts a fresh pass over
     * the current log.
     */
    public Iterable<AgentMessage> since(String agentId, Instant since) {
        return () -> messages.stream()
                .filter(m -> m.toAgent().equals(agentId))
                .filter(m -> !m.timestamp().isBefore(since))
                .iterator();
    }

    public int size() {
        return messages.size();
    }

    private void purgeOlderThan(Instant cutoff) {
        int before = messages.size();
        messages.removeIf(m -> m.timestamp().isBefore(cutoff));
        int purged = before - messages.size();
        if (purged > 0) {
            log.debug("Purged {} message(s) older than {}", purged, cutoff);
        }
    }
}
