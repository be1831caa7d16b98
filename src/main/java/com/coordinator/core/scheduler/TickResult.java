package com.coordinator.core.scheduler;

import java.util.List;

/**
 * Outcome of one scheduling tick.
 *
 * @param assignments  matches made, in assignment order
 * @param readyCount   tasks that were ready when the tick started
 * @param pendingCount tasks still PENDING after the tick
 */
public record TickResult(
    List<Assignment> assignments,
    int readyCount,
    int pendingCount
) {
    public static TickResult empty(int pendingCount) {
        return new TickResult(List.of(), 0, pendingCount);
    }
}
