package dev.taskgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Queue config. visibilityTimeout is the lease length of a dequeued message;
 * publish* control the bounded exponential backoff used when the queue is unavailable.
 * deadLetterRetention caps how many dead-lettered task ids are remembered.
 */
@ConfigurationProperties(prefix = "taskgate.queue")
public record QueueProperties(Duration visibilityTimeout, int publishMaxAttempts, Duration publishBackoff,
                              int deadLetterRetention) {
    public QueueProperties {
        if (visibilityTimeout == null) visibilityTimeout = Duration.ofMinutes(5);
        if (publishMaxAttempts <= 0) publishMaxAttempts = 3;
        if (publishBackoff == null) publishBackoff = Duration.ofMillis(200);
        if (deadLetterRetention <= 0) deadLetterRetention = 1000;
    }

    public static QueueProperties defaults() {
        return new QueueProperties(null, 0, null, 0);
    }
}
