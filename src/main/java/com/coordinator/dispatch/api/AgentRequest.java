package com.coordinator.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/agents.
 * <p>
 * When {@code roleTemplate} is set, the agent is built by the template provider and only
 * {@code id} and {@code projectPath} are read from the request.
 *
 * @param id                 agent id; required
 * @param name               display name; defaults to the id
 * @param role               declared role
 * @param capabilities       capability tags
 * @param projectPath        working directory; nullable
 * @param maxConcurrentTasks declared concurrency limit; nullable, defaults to 1
 * @param prompt             role prompt; nullable
 * @param roleTemplate       template role id; nullable
 */
public record AgentRequest(
    String id,
    String name,
    String role,
    List<String> capabilities,
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("max_concurrent_tasks") Integer maxConcurrentTasks,
    String prompt,
    @JsonProperty("role_template") String roleTemplate
) {}
