package dev.taskgate.queue;

import dev.taskgate.config.QueueProperties;
import dev.taskgate.domain.entity.TaskRecord;
import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.enums.TaskStatus;
import dev.taskgate.repository.TaskRecordRepository;
import dev.taskgate.support.Fixtures;
import dev.taskgate.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskRecoveryTest {

    private final TaskRecordRepository repository = mock(TaskRecordRepository.class);
    private final MutableClock clock = new MutableClock(Fixtures.NOW);
    private final InMemoryTaskQueue queue = new InMemoryTaskQueue(QueueProperties.defaults(), clock);

    @Test
    @DisplayName("unfinished tasks from a previous run go back on the queue by priority, then age")
    void reEnqueuesUnfinishedTasks() throws Exception {
        TaskRecord oldNormal = record("old-normal", TaskPriority.NORMAL, 0);
        TaskRecord running = record("running", TaskPriority.HIGH, 1);
        running.markRunning(Fixtures.NOW);
        TaskRecord newNormal = record("new-normal", TaskPriority.NORMAL, 2);
        TaskRecovery recovery = new TaskRecovery(repository, queue, clock);
        when(repository.findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                EnumSet.of(TaskStatus.QUEUED, TaskStatus.RUNNING), Fixtures.NOW))
                .thenReturn(List.of(oldNormal, running, newNormal));

        assertThat(recovery.recover()).isEqualTo(3);

        List<String> order = new ArrayList<>();
        Optional<Lease> next;
        while ((next = queue.dequeue(Duration.ZERO)).isPresent()) order.add(next.get().taskId());
        assertThat(order).containsExactly("running", "old-normal", "new-normal");
    }

    @Test
    @DisplayName("only records created before startup are considered")
    void cutoffIsBootTime() {
        TaskRecovery recovery = new TaskRecovery(repository, queue, clock);
        clock.advance(Duration.ofMinutes(1));

        assertThat(recovery.recover()).isZero();

        verify(repository).findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                EnumSet.of(TaskStatus.QUEUED, TaskStatus.RUNNING), Fixtures.NOW);
        assertThat(queue.length()).isZero();
    }

    @Test
    @DisplayName("a recovered message carries the stored task fields")
    void recoveredMessageMatchesRecord() throws Exception {
        TaskRecord stored = record("task-7", TaskPriority.CRITICAL, 5);
        when(repository.findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                EnumSet.of(TaskStatus.QUEUED, TaskStatus.RUNNING), Fixtures.NOW))
                .thenReturn(List.of(stored));

        new TaskRecovery(repository, queue, clock).recover();

        Lease lease = queue.dequeue(Duration.ZERO).orElseThrow();
        assertThat(lease.message().inputMessage()).isEqualTo("do task-7");
        assertThat(lease.message().priority()).isEqualTo(TaskPriority.CRITICAL);
        assertThat(lease.message().createdAt()).isEqualTo(stored.getCreatedAt());
    }

    private static TaskRecord record(String taskId, TaskPriority priority, int minutesBeforeBoot) {
        return TaskRecord.accept(Fixtures.message(taskId, priority),
                Fixtures.NOW.minus(Duration.ofMinutes(10 - minutesBeforeBoot)));
    }
}
