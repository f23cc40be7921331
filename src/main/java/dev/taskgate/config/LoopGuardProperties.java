package dev.taskgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Loop guard config. store is "jpa" (survives restarts) or "memory".
 */
@ConfigurationProperties(prefix = "taskgate.loop-guard")
public record LoopGuardProperties(Duration ttl, String store) {
    public LoopGuardProperties {
        if (ttl == null) ttl = Duration.ofHours(1);
        if (store == null || store.isBlank()) store = "jpa";
    }
}
