package com.coordinator.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A message exchanged between agents through the message bus. Immutable once appended.
 *
 * @param sequence    strictly increasing position in the log
 * @param id          unique message identifier
 * @param fromAgent   sender agent id
 * @param toAgent     recipient agent id
 * @param messageType free-form type tag (e.g. "handoff", "question")
 * @param content     message body
 * @param timestamp   append time
 * @param taskId      related task (nullable)
 */
public record AgentMessage(
    long sequence,
    String id,
    String fromAgent,
    String toAgent,
    String messageType,
    String content,
    Instant timestamp,
    String taskId
) implements Serializable {}
