package com.coordinator.dispatch.api;

import com.coordinator.core.engine.MultiAgentCoordinator;
import com.coordinator.core.model.AgentMessage;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the inter-agent message bus.
 */
@RestController
@RequestMapping("/api/v1/messages")
public class MessageController {

    private final MultiAgentCoordinator coordinator;

    public MessageController(MultiAgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * POST /api/v1/messages: Append a message to the log.
     */
    @PostMapping
    public ResponseEntity<?> post(@RequestBody MessageRequest request) {
        if (request.toAgent() == null || request.toAgent().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "to_agent is required"));
        }
        AgentMessage message = coordinator.postMessage(request.fromAgent(), request.toAgent(),
                request.messageType(), request.content(), request.taskId());
        return ResponseEntity.status(HttpStatus.CREATED).body(MessageResponse.from(message));
    }

    /**
     * GET /api/v1/messages?agent=...&amp;since=...: Messages for an agent at or after an epoch-millis time.
     */
    @GetMapping
    public ResponseEntity<List<MessageResponse>> since(@RequestParam String agent,
                                                       @RequestParam(defaultValue = "0") long since) {
        var result = new ArrayList<MessageResponse>();
        for (AgentMessage message : coordinator.messagesSince(agent, Instant.ofEpochMilli(since))) {
            result.add(MessageResponse.from(message));
        }
        return ResponseEntity.ok(result);
    }

    /**
     * JSON representation of a message.
     */
    public record MessageResponse(
        long sequence,
        String id,
        @JsonProperty("from_agent") String fromAgent,
        @JsonProperty("to_agent") String toAgent,
        @JsonProperty("message_type") String messageType,
        String content,
        long timestamp,
        @JsonProperty("task_id") String taskId
    ) {
        static MessageResponse from(AgentMessage m) {
            return new MessageResponse(m.sequence(), m.id(), m.fromAgent(), m.toAgent(),
                    m.messageType(), m.content(), m.timestamp().toEpochMilli(), m.taskId());
        }
    }
}
