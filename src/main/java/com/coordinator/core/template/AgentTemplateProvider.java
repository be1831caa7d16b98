package com.coordinator.core.template;

import com.coordinator.core.model.AgentTemplate;

import java.util.Set;

/**
 * Source of agent definitions by role.
 */
public interface AgentTemplateProvider {

    /**
     * Builds the definition of one agent instance.
     *
     * @param roleId      role identifier (e.g. "backend_developer")
     * @param instanceId  id the new agent will be registered under
     * @param projectPath working directory for the agent; null means the current directory
     * @throws com.coordinator.core.UnknownRoleException if the role is not defined
     */
    AgentTemplate create(String roleId, String instanceId, String projectPath);

    Set<String> roles();
}
