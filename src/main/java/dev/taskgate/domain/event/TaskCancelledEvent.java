package dev.taskgate.domain.event;

import java.time.Instant;

/**
 * Published when a task is cancelled. Consumed by the worker pool so the execution
 * engine can stop an in-flight run.
 */
public record TaskCancelledEvent(String taskId, Instant occurredAt) {
    public TaskCancelledEvent {
        if (taskId == null) throw new IllegalArgumentException("taskId required");
        if (occurredAt == null) occurredAt = Instant.now();
    }
}
