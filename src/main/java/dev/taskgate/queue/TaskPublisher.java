package dev.taskgate.queue;

import dev.taskgate.config.QueueProperties;
import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.exception.QueueUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Enqueues with bounded exponential backoff. Only {@link QueueUnavailableException} is
 * retried; once attempts run out it propagates to the caller.
 */
@Component
public class TaskPublisher {
    private static final Logger log = LoggerFactory.getLogger(TaskPublisher.class);

    private final TaskQueue queue;
    private final Retry retry;

    public TaskPublisher(TaskQueue queue, QueueProperties properties) {
        this.queue = queue;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.publishMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(properties.publishBackoff(), 2.0))
                .retryExceptions(QueueUnavailableException.class)
                .build();
        this.retry = Retry.of("task-publish", config);
        this.retry.getEventPublisher().onRetry(e -> log.warn("Enqueue attempt {} failed: {}",
                e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));
    }

    public void publish(TaskMessage message) {
        Retry.decorateRunnable(retry, () -> queue.enqueue(message)).run();
        log.info("Published task {} provider={} priority={}",
                message.taskId(), message.provider(), message.priority());
    }
}
