package com.coordinator.core.events;

import java.util.Map;

/**
 * Fire-and-forget sink for coordinator lifecycle events.
 * <p>
 * Implementations must not throw and must not block on network I/O; delivery failures
 * are logged and dropped. Callers never invoke this while holding coordinator locks.
 */
@FunctionalInterface
public interface ObservabilityNotifier {

    void notify(String eventType, Map<String, Object> payload);
}
