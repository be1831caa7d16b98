package com.coordinator.dispatch.api;

import com.coordinator.core.engine.MultiAgentCoordinator;
import com.coordinator.core.model.AgentMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MessageController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class MessageControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MultiAgentCoordinator coordinator;

    private static AgentMessage message(long seq, String content) {
        return new AgentMessage(seq, "MSG-" + seq, "be-1", "fe-1", "handoff", content, T0, "TASK-1");
    }

    @Test
    @DisplayName("POST /messages appends and returns 201")
    void post201() throws Exception {
        when(coordinator.postMessage("be-1", "fe-1", "handoff", "API is live", "TASK-1"))
                .thenReturn(message(1, "API is live"));

        mockMvc.perform(post("/api/v1/messages").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"from_agent":"be-1","to_agent":"fe-1","message_type":"handoff",
                                 "content":"API is live","task_id":"TASK-1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sequence").value(1))
                .andExpect(jsonPath("$.to_agent").value("fe-1"))
                .andExpect(jsonPath("$.timestamp").value(T0.toEpochMilli()));
    }

    @Test
    @DisplayName("POST /messages without a recipient returns 400")
    void missingRecipient() throws Exception {
        mockMvc.perform(post("/api/v1/messages").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from_agent\":\"be-1\",\"content\":\"hello?\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(coordinator);
    }

    @Test
    @DisplayName("GET /messages reads an agent's messages since a time")
    void since() throws Exception {
        when(coordinator.messagesSince("fe-1", Instant.ofEpochMilli(T0.toEpochMilli())))
                .thenReturn(List.of(message(1, "one"), message(2, "two")));

        mockMvc.perform(get("/api/v1/messages")
                        .param("agent", "fe-1")
                        .param("since", String.valueOf(T0.toEpochMilli())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].content").value("two"));
    }

    @Test
    @DisplayName("GET /messages defaults since to the epoch")
    void sinceDefault() throws Exception {
        when(coordinator.messagesSince("fe-1", Instant.EPOCH)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/messages").param("agent", "fe-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        verify(coordinator).messagesSince("fe-1", Instant.EPOCH);
    }
}
