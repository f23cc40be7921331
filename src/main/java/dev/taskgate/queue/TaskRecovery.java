package dev.taskgate.queue;

import dev.taskgate.domain.entity.TaskRecord;
import dev.taskgate.domain.enums.TaskStatus;
import dev.taskgate.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Puts tasks a previous process left QUEUED or RUNNING back on the queue once the
 * application is ready. Only records created before this instance started are
 * considered, so webhooks accepted during startup are not enqueued twice.
 */
@Component
public class TaskRecovery {
    private static final Logger log = LoggerFactory.getLogger(TaskRecovery.class);

    private final TaskRecordRepository repository;
    private final TaskQueue queue;
    private final Instant bootTime;

    public TaskRecovery(TaskRecordRepository repository, TaskQueue queue, Clock clock) {
        this.repository = repository;
        this.queue = queue;
        this.bootTime = clock.instant();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    int recover() {
        List<TaskRecord> pending = repository.findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                EnumSet.of(TaskStatus.QUEUED, TaskStatus.RUNNING), bootTime);
        for (TaskRecord record : pending) {
            queue.enqueue(record.toMessage());
            log.debug("Re-enqueued task {} ({})", record.getTaskId(), record.getStatus());
        }
        if (!pending.isEmpty()) log.info("Re-enqueued {} task(s) left unfinished by a previous run", pending.size());
        return pending.size();
    }
}
