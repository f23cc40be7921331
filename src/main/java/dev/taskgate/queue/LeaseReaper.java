package dev.taskgate.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically returns messages whose consumer stopped heartbeating to the queue.
 */
@Component
public class LeaseReaper {
    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final TaskQueue queue;

    public LeaseReaper(TaskQueue queue) {
        this.queue = queue;
    }

    @Scheduled(fixedDelayString = "${taskgate.queue.reaper-interval-ms:5000}")
    public void reap() {
        int reaped = queue.reapExpiredLeases();
        if (reaped > 0) log.warn("Lease expired for {} task(s); returned to queue", reaped);
    }
}
