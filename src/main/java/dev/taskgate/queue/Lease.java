package dev.taskgate.queue;

import dev.taskgate.domain.valueobject.TaskMessage;

/**
 * One delivery of a message. Every dequeue hands out a new epoch, so a consumer whose
 * lease expired and went to another consumer can no longer settle or extend it.
 */
public record Lease(TaskMessage message, long epoch) {

    public String taskId() {
        return message.taskId();
    }
}
