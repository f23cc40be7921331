package dev.taskgate.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.taskgate.domain.enums.TaskPriority;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * The unit of work placed on the queue. Immutable once enqueued; its JSON form is the
 * queue wire format.
 */
public record TaskMessage(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("installation_id") String installationId,
        @JsonProperty("provider") String provider,
        @JsonProperty("input_message") String inputMessage,
        @JsonProperty("priority") TaskPriority priority,
        @JsonProperty("source_metadata") Map<String, String> sourceMetadata,
        @JsonProperty("created_at") Instant createdAt
) {
    public TaskMessage {
        if (taskId == null || taskId.isBlank()) throw new IllegalArgumentException("taskId required");
        if (priority == null) priority = TaskPriority.NORMAL;
        sourceMetadata = sourceMetadata == null ? Map.of() : Map.copyOf(sourceMetadata);
        if (createdAt == null) createdAt = Instant.now();
    }

    public static TaskMessage from(WebhookEvent event, TaskRequest request, Instant now) {
        return new TaskMessage(newTaskId(), event.installationId(), event.provider(),
                request.inputMessage(), request.priority(), request.sourceMetadata(), now);
    }

    public static String newTaskId() {
        return "task-" + UUID.randomUUID().toString().replace("-", "");
    }
}
