package dev.taskgate.domain.entity;

import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.enums.TaskStatus;
import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.exception.InvalidTransitionException;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Persisted lifecycle view of a dispatched task.
 *
 * Design: the id is the queue message's task id, so a redelivered message maps onto the
 * same row; every status change goes through {@link #transitionTo} which rejects anything
 * the state machine does not allow; optimistic locking guards against two workers
 * racing on a redelivered message.
 */
@Entity
@Table(name = "task_records", indexes = {
        @Index(name = "idx_task_status", columnList = "status"),
        @Index(name = "idx_task_installation", columnList = "installation_id"),
        @Index(name = "idx_task_created", columnList = "created_at")
})
public class TaskRecord {

    @Id
    @Column(name = "task_id", length = 64)
    private String taskId;

    @Column(name = "installation_id")
    private String installationId;

    @Column(nullable = false, length = 32)
    private String provider;

    @Column(name = "input_message", nullable = false, columnDefinition = "text")
    private String inputMessage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TaskPriority priority;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_source_metadata", joinColumns = @JoinColumn(name = "task_id"))
    @MapKeyColumn(name = "meta_key")
    @Column(name = "meta_value", columnDefinition = "text")
    private Map<String, String> sourceMetadata = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "output", columnDefinition = "text")
    private String output;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "tokens_used")
    private Long tokensUsed;

    @Column(name = "cost_usd", precision = 12, scale = 6)
    private BigDecimal costUsd;

    protected TaskRecord() {
    }

    public static TaskRecord accept(TaskMessage message, Instant now) {
        TaskRecord r = new TaskRecord();
        r.taskId = message.taskId();
        r.installationId = message.installationId();
        r.provider = message.provider();
        r.inputMessage = message.inputMessage();
        r.priority = message.priority();
        r.sourceMetadata = new HashMap<>(message.sourceMetadata());
        r.status = TaskStatus.QUEUED;
        r.createdAt = now;
        r.updatedAt = now;
        return r;
    }

    /** Rebuilds the queue message this record was accepted from. */
    public TaskMessage toMessage() {
        return new TaskMessage(taskId, installationId, provider, inputMessage, priority, sourceMetadata, createdAt);
    }

    public void markRunning(Instant now) {
        transitionTo(TaskStatus.RUNNING, now);
        if (startedAt == null) startedAt = now;
    }

    public void markWaitingInput(Instant now) {
        transitionTo(TaskStatus.WAITING_INPUT, now);
    }

    public void markCompleted(String output, long tokensUsed, BigDecimal costUsd, Instant now) {
        transitionTo(TaskStatus.COMPLETED, now);
        this.output = output;
        finish(tokensUsed, costUsd, now);
    }

    public void markFailed(String error, long tokensUsed, BigDecimal costUsd, Instant now) {
        transitionTo(TaskStatus.FAILED, now);
        this.errorMessage = error;
        finish(tokensUsed, costUsd, now);
    }

    public void markCancelled(Instant now) {
        transitionTo(TaskStatus.CANCELLED, now);
    }

    private void finish(long tokens, BigDecimal cost, Instant now) {
        this.completedAt = now;
        this.durationMs = startedAt != null ? Duration.between(startedAt, now).toMillis() : 0L;
        this.tokensUsed = tokens;
        this.costUsd = cost != null ? cost : BigDecimal.ZERO;
    }

    private void transitionTo(TaskStatus target, Instant now) {
        if (!status.canTransitionTo(target))
            throw new InvalidTransitionException(taskId, status, target);
        this.status = target;
        this.updatedAt = now;
    }

    // Getters
    public String getTaskId() {
        return taskId;
    }

    public String getInstallationId() {
        return installationId;
    }

    public String getProvider() {
        return provider;
    }

    public String getInputMessage() {
        return inputMessage;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public Map<String, String> getSourceMetadata() {
        return Map.copyOf(sourceMetadata);
    }

    public TaskStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public String getOutput() {
        return output;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Long getTokensUsed() {
        return tokensUsed;
    }

    public BigDecimal getCostUsd() {
        return costUsd;
    }
}
