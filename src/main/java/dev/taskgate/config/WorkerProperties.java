package dev.taskgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "taskgate.worker")
public record WorkerProperties(boolean enabled, int poolSize, Duration pollTimeout, Duration heartbeatInterval) {
    public WorkerProperties {
        if (poolSize <= 0) poolSize = 4;
        if (pollTimeout == null) pollTimeout = Duration.ofSeconds(5);
        if (heartbeatInterval == null) heartbeatInterval = Duration.ofSeconds(60);
    }
}
