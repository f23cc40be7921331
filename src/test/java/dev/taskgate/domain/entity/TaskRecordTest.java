package dev.taskgate.domain.entity;

import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.enums.TaskStatus;
import dev.taskgate.exception.InvalidTransitionException;
import dev.taskgate.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskRecordTest {

    private static final Instant T1 = Fixtures.NOW.plusSeconds(1);
    private static final Instant T2 = Fixtures.NOW.plusSeconds(2);

    @Test
    @DisplayName("new records start QUEUED")
    void startsQueued() {
        TaskRecord record = newRecord();
        assertThat(record.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(record.getStartedAt()).isNull();
        assertThat(record.getSourceMetadata()).isEmpty();
    }

    @Test
    @DisplayName("startedAt is set on the first RUNNING transition only")
    void startedAtSetOnce() {
        TaskRecord record = newRecord();
        record.markRunning(Fixtures.NOW);
        record.markWaitingInput(T1);
        record.markRunning(T2);

        assertThat(record.getStatus()).isEqualTo(TaskStatus.RUNNING);
        assertThat(record.getStartedAt()).isEqualTo(Fixtures.NOW);
        assertThat(record.getUpdatedAt()).isEqualTo(T2);
    }

    @Test
    @DisplayName("failure stores the error and defaults cost to zero")
    void failureFields() {
        TaskRecord record = newRecord();
        record.markRunning(Fixtures.NOW);
        record.markFailed("engine crashed", 15, null, T2);

        assertThat(record.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(record.getErrorMessage()).isEqualTo("engine crashed");
        assertThat(record.getCostUsd()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(record.getDurationMs()).isEqualTo(2000L);
    }

    @Test
    @DisplayName("a completed task cannot run again")
    void completedCannotRun() {
        TaskRecord record = newRecord();
        record.markRunning(Fixtures.NOW);
        record.markCompleted("ok", 1, BigDecimal.ONE, T1);

        assertThatThrownBy(() -> record.markRunning(T2))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("COMPLETED")
                .hasMessageContaining("RUNNING");
        assertThat(record.getStatus()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("a QUEUED task cannot complete without running")
    void queuedCannotComplete() {
        TaskRecord record = newRecord();
        assertThatThrownBy(() -> record.markCompleted("ok", 0, null, T1))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(record.getOutput()).isNull();
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    @DisplayName("terminal states allow no further transition")
    void terminalStatesAreFinal(TaskStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (TaskStatus target : TaskStatus.values())
            assertThat(terminal.canTransitionTo(target)).as("%s -> %s", terminal, target).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"QUEUED", "RUNNING", "WAITING_INPUT"})
    @DisplayName("every live state can be cancelled")
    void liveStatesCancellable(TaskStatus live) {
        assertThat(live.canTransitionTo(TaskStatus.CANCELLED)).isTrue();
    }

    private static TaskRecord newRecord() {
        return TaskRecord.accept(Fixtures.message("task-1", TaskPriority.NORMAL), Fixtures.NOW);
    }
}
