package dev.taskgate.loopguard;

import dev.taskgate.config.LoopGuardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local loop guard. The window is lost on restart.
 */
@Component
@ConditionalOnProperty(prefix = "taskgate.loop-guard", name = "store", havingValue = "memory")
public class InMemoryLoopGuard implements LoopGuard {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLoopGuard.class);

    private final Map<String, Instant> posted = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryLoopGuard(LoopGuardProperties properties, Clock clock) {
        this.ttl = properties.ttl();
        this.clock = clock;
    }

    @Override
    public void recordSelfPosted(String externalId) {
        if (externalId == null || externalId.isBlank()) return;
        posted.put(externalId, clock.instant());
    }

    @Override
    public boolean isSelfPosted(String externalId) {
        if (externalId == null || externalId.isBlank()) return false;
        Instant insertedAt = posted.get(externalId);
        if (insertedAt == null) return false;
        if (isExpired(insertedAt, clock.instant())) {
            posted.remove(externalId, insertedAt);
            return false;
        }
        return true;
    }

    @Scheduled(fixedDelayString = "${taskgate.loop-guard.purge-interval-ms:600000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = posted.size();
        posted.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        log.debug("Loop guard purge removed {} entries", before - posted.size());
    }

    private boolean isExpired(Instant insertedAt, Instant now) {
        return !insertedAt.plus(ttl).isAfter(now);
    }
}
