package dev.taskgate.loopguard;

import dev.taskgate.config.LoopGuardProperties;
import dev.taskgate.domain.entity.SelfPostedMessage;
import dev.taskgate.repository.SelfPostedMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Loop guard backed by {@code self_posted_messages}, so the window survives restarts.
 * Expired rows are ignored on read and deleted by a periodic purge.
 */
@Component
@ConditionalOnProperty(prefix = "taskgate.loop-guard", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaLoopGuard implements LoopGuard {
    private static final Logger log = LoggerFactory.getLogger(JpaLoopGuard.class);

    private final SelfPostedMessageRepository repository;
    private final Duration ttl;
    private final Clock clock;

    public JpaLoopGuard(SelfPostedMessageRepository repository, LoopGuardProperties properties, Clock clock) {
        this.repository = repository;
        this.ttl = properties.ttl();
        this.clock = clock;
    }

    @Override
    public void recordSelfPosted(String externalId) {
        if (externalId == null || externalId.isBlank()) return;
        repository.save(new SelfPostedMessage(externalId, clock.instant()));
    }

    @Override
    public boolean isSelfPosted(String externalId) {
        if (externalId == null || externalId.isBlank()) return false;
        return repository.existsByExternalIdAndInsertedAtAfter(externalId, clock.instant().minus(ttl));
    }

    @Scheduled(fixedDelayString = "${taskgate.loop-guard.purge-interval-ms:600000}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        int deleted = repository.deleteExpired(cutoff);
        if (deleted > 0) log.info("Purged {} expired self-posted entries", deleted);
    }
}
