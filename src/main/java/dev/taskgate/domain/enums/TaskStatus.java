package dev.taskgate.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle: QUEUED → RUNNING ⇄ WAITING_INPUT → COMPLETED | FAILED, with CANCELLED
 * reachable from every non-terminal state.
 */
public enum TaskStatus {
    QUEUED, RUNNING, WAITING_INPUT, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(WAITING_INPUT, COMPLETED, FAILED, CANCELLED);
            case WAITING_INPUT -> EnumSet.of(RUNNING, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }
}
