package com.coordinator.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing coordinator-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setTask(String taskId, String agentId) {
        MDC.put("taskId", taskId);
        if (agentId != null) {
            MDC.put("agentId", agentId);
        } else {
            MDC.remove("agentId");
        }
    }

    public static void setTick(long tickNumber) {
        MDC.put("tick", String.valueOf(tickNumber));
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("agentId");
        MDC.remove("tick");
    }
}
