package dev.taskgate.service;

import dev.taskgate.domain.entity.TaskRecord;
import dev.taskgate.domain.enums.TaskStatus;
import dev.taskgate.domain.event.TaskCancelledEvent;
import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.exception.InvalidTransitionException;
import dev.taskgate.exception.TaskNotFoundException;
import dev.taskgate.queue.TaskPublisher;
import dev.taskgate.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every write to a {@link TaskRecord} goes through here, one short transaction per
 * transition. The entity enforces which transitions are legal.
 */
@Service
public class TaskLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleService.class);

    public static final String ORIGINAL_INPUT_KEY = "original_input";

    private final TaskRecordRepository repository;
    private final TaskPublisher publisher;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public TaskLifecycleService(TaskRecordRepository repository, TaskPublisher publisher,
                                ApplicationEventPublisher eventPublisher, Clock clock) {
        this.repository = repository;
        this.publisher = publisher;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public TaskRecord accept(TaskMessage message) {
        TaskRecord record = repository.save(TaskRecord.accept(message, clock.instant()));
        log.info("Accepted task {} from {} priority={}", message.taskId(), message.provider(), message.priority());
        return record;
    }

    /**
     * Drops a record whose message never reached the queue.
     */
    @Transactional
    public void discard(String taskId) {
        TaskRecord record = load(taskId);
        if (record.getStatus() != TaskStatus.QUEUED)
            throw new InvalidTransitionException(taskId, record.getStatus(), TaskStatus.CANCELLED);
        repository.delete(record);
        log.warn("Discarded task {}: it was never enqueued", taskId);
    }

    /**
     * Moves a dequeued task to RUNNING. A task already RUNNING is a redelivery after a
     * lease expiry and is resumed as-is. Empty for terminal tasks, which must not run.
     */
    @Transactional
    public Optional<TaskRecord> beginExecution(String taskId) {
        TaskRecord record = load(taskId);
        if (record.getStatus().isTerminal()) {
            log.info("Skipping task {}: already {}", taskId, record.getStatus());
            return Optional.empty();
        }
        if (record.getStatus() == TaskStatus.RUNNING) {
            log.warn("Task {} redelivered while RUNNING; resuming", taskId);
            return Optional.of(record);
        }
        record.markRunning(clock.instant());
        return Optional.of(repository.save(record));
    }

    @Transactional
    public TaskRecord awaitInput(String taskId) {
        TaskRecord record = load(taskId);
        record.markWaitingInput(clock.instant());
        log.info("Task {} waiting for input", taskId);
        return repository.save(record);
    }

    /**
     * Answers a task waiting for input by sending it back to the workers. The message
     * carries the reply as its input and the original instruction under
     * {@value #ORIGINAL_INPUT_KEY}; the record stays WAITING_INPUT until a worker picks
     * it up.
     *
     * @throws InvalidTransitionException if the task is not waiting for input
     */
    @Transactional(readOnly = true)
    public TaskRecord resume(String taskId, String input) {
        if (input == null || input.isBlank()) throw new IllegalArgumentException("input is required");
        TaskRecord record = load(taskId);
        if (record.getStatus() != TaskStatus.WAITING_INPUT)
            throw new InvalidTransitionException(taskId, record.getStatus(), TaskStatus.RUNNING);

        TaskMessage original = record.toMessage();
        Map<String, String> metadata = new HashMap<>(original.sourceMetadata());
        metadata.put(ORIGINAL_INPUT_KEY, original.inputMessage());
        publisher.publish(new TaskMessage(taskId, original.installationId(), original.provider(), input,
                original.priority(), metadata, clock.instant()));
        log.info("Task {} resumed with new input", taskId);
        return record;
    }

    @Transactional
    public TaskRecord complete(String taskId, String output, long tokensUsed, BigDecimal costUsd) {
        TaskRecord record = load(taskId);
        record.markCompleted(output, tokensUsed, costUsd, clock.instant());
        log.info("Task {} completed in {}ms, tokens={}, cost={}",
                taskId, record.getDurationMs(), tokensUsed, costUsd);
        return repository.save(record);
    }

    @Transactional
    public TaskRecord fail(String taskId, String error, long tokensUsed, BigDecimal costUsd) {
        TaskRecord record = load(taskId);
        record.markFailed(error, tokensUsed, costUsd, clock.instant());
        log.warn("Task {} failed after {}ms: {}", taskId, record.getDurationMs(), error);
        return repository.save(record);
    }

    /**
     * Flips the task to CANCELLED and announces it; stopping a run in progress is up to the
     * execution engine.
     */
    @Transactional
    public TaskRecord cancel(String taskId) {
        TaskRecord record = load(taskId);
        record.markCancelled(clock.instant());
        TaskRecord saved = repository.save(record);
        eventPublisher.publishEvent(new TaskCancelledEvent(taskId, clock.instant()));
        log.info("Task {} cancelled", taskId);
        return saved;
    }

    @Transactional(readOnly = true)
    public TaskRecord get(String taskId) {
        return load(taskId);
    }

    @Transactional(readOnly = true)
    public Page<TaskRecord> list(TaskStatus status, int page, int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100));
        return status == null
                ? repository.findAllByOrderByCreatedAtDesc(pageable)
                : repository.findByStatusOrderByCreatedAtDesc(status, pageable);
    }

    private TaskRecord load(String taskId) {
        return repository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
