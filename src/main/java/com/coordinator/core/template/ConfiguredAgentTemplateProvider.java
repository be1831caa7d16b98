package com.coordinator.core.template;

import com.coordinator.core.UnknownRoleException;
import com.coordinator.core.config.CoordinatorProperties;
import com.coordinator.core.model.AgentTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Serves agent templates from {@code coordinator.templates.<role>} in application configuration.
 */
@Component
public class ConfiguredAgentTemplateProvider implements AgentTemplateProvider {

    private final CoordinatorProperties properties;

    public ConfiguredAgentTemplateProvider(CoordinatorProperties properties) {
        this.properties = properties;
    }

    @Override
    public AgentTemplate create(String roleId, String instanceId, String projectPath) {
        CoordinatorProperties.Template template = properties.getTemplates().get(roleId);
        if (template == null) {
            throw new UnknownRoleException(roleId);
        }
        String name = template.getName() != null ? template.getName() : roleId;
        return new AgentTemplate(
                instanceId,
                name,
                roleId,
                new LinkedHashSet<>(template.getCapabilities()),
                projectPath != null && !projectPath.isBlank() ? projectPath : ".",
                template.getMaxConcurrentTasks(),
                template.getPrompt());
    }

    @Override
    public Set<String> roles() {
        return new LinkedHashSet<>(properties.getTemplates().keySet());
    }
}
