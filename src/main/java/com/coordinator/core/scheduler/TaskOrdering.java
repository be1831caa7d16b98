package com.coordinator.core.scheduler;

import com.coordinator.core.model.Task;

import java.util.Comparator;

/**
 * Ordering of ready tasks: priority descending, then insertion sequence. The sequence is
 * taken in the same critical section as {@code createdAt}, so it is the creation order
 * even if the wall clock steps back.
 */
public final class TaskOrdering {

    public static final Comparator<Task> READY_ORDER = Comparator
            .comparing((Task t) -> t.priority().level(), Comparator.reverseOrder())
            .thenComparingLong(Task::sequence);

    private TaskOrdering() {}
}
