package dev.taskgate.dto.response;

import dev.taskgate.domain.entity.TaskRecord;
import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.enums.TaskStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record TaskResponse(
        String taskId, String installationId, String provider, String inputMessage,
        TaskPriority priority, TaskStatus status, Map<String, String> sourceMetadata,
        Instant createdAt, Instant startedAt, Instant completedAt, Long durationMs,
        String output, String error, Long tokensUsed, BigDecimal costUsd
) {
    public static TaskResponse from(TaskRecord r) {
        return new TaskResponse(r.getTaskId(), r.getInstallationId(), r.getProvider(), r.getInputMessage(),
                r.getPriority(), r.getStatus(), Map.copyOf(r.getSourceMetadata()),
                r.getCreatedAt(), r.getStartedAt(), r.getCompletedAt(), r.getDurationMs(),
                r.getOutput(), r.getErrorMessage(), r.getTokensUsed(), r.getCostUsd());
    }
}
