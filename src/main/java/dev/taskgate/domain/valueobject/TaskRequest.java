package dev.taskgate.domain.valueobject;

import dev.taskgate.domain.enums.TaskPriority;

import java.util.Map;

/** What a handler wants done for an event; the router turns it into a {@link TaskMessage}. */
public record TaskRequest(String inputMessage, Map<String, String> sourceMetadata, TaskPriority priority) {
    public TaskRequest {
        if (inputMessage == null || inputMessage.isBlank())
            throw new IllegalArgumentException("inputMessage required");
        sourceMetadata = sourceMetadata == null ? Map.of() : Map.copyOf(sourceMetadata);
        if (priority == null) priority = TaskPriority.NORMAL;
    }
}
