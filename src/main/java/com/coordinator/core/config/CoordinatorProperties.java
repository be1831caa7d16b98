package com.coordinator.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "coordinator")
public class CoordinatorProperties {

    private int maxConcurrentAgents = 5;
    private int taskTimeoutMinutes = 60;
    private int healthCheckInterval = 30;
    private String observabilityServer = "http://localhost:4000";
    private int maxTaskRetries = 3;
    private int messageRetentionHours = 24;
    private boolean autoAssignTasks = true;
    private String sessionId = "coordinator";
    private Observability observability = new Observability();
    private Map<String, Template> templates = new LinkedHashMap<>();

    public Duration getTaskTimeout() { return Duration.ofMinutes(taskTimeoutMinutes); }
    public Duration getMessageRetention() { return Duration.ofHours(messageRetentionHours); }
    public boolean isObservabilityEnabled() { return observability.enabled; }

    public int getMaxConcurrentAgents() { return maxConcurrentAgents; }
    public void setMaxConcurrentAgents(int maxConcurrentAgents) { this.maxConcurrentAgents = maxConcurrentAgents; }
    public int getTaskTimeoutMinutes() { return taskTimeoutMinutes; }
    public void setTaskTimeoutMinutes(int taskTimeoutMinutes) { this.taskTimeoutMinutes = taskTimeoutMinutes; }
    public int getHealthCheckInterval() { return healthCheckInterval; }
    public void setHealthCheckInterval(int healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
    public String getObservabilityServer() { return observabilityServer; }
    public void setObservabilityServer(String observabilityServer) { this.observabilityServer = observabilityServer; }
    public int getMaxTaskRetries() { return maxTaskRetries; }
    public void setMaxTaskRetries(int maxTaskRetries) { this.maxTaskRetries = maxTaskRetries; }
    public int getMessageRetentionHours() { return messageRetentionHours; }
    public void setMessageRetentionHours(int messageRetentionHours) { this.messageRetentionHours = messageRetentionHours; }
    public boolean isAutoAssignTasks() { return autoAssignTasks; }
    public void setAutoAssignTasks(boolean autoAssignTasks) { this.autoAssignTasks = autoAssignTasks; }
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public Observability getObservability() { return observability; }
    public void setObservability(Observability observability) { this.observability = observability; }
    public Map<String, Template> getTemplates() { return templates; }
    public void setTemplates(Map<String, Template> templates) { this.templates = templates; }

    public static class Observability {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Role definition used by the configured template provider, keyed by role id.
     */
    public static class Template {
        private String name;
        private String description;
        private List<String> capabilities = new ArrayList<>();
        private int maxConcurrentTasks = 1;
        private String prompt;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }
        public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }
    }
}
