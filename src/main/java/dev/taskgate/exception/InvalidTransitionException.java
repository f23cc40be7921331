package dev.taskgate.exception;

import dev.taskgate.domain.enums.TaskStatus;

public class InvalidTransitionException extends RuntimeException {
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Task %s cannot move from %s to %s".formatted(taskId, from, to));
        this.from = from;
        this.to = to;
    }

    public TaskStatus getFrom() { return from; }
    public TaskStatus getTo() { return to; }
}
