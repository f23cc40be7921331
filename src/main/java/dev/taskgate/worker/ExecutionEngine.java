package dev.taskgate.worker;

import dev.taskgate.domain.valueobject.TaskMessage;

/**
 * Runs a task to completion. Provided by the deployment; without a bean of this type the
 * worker pool does not start.
 */
public interface ExecutionEngine {

    /**
     * Blocks until the run ends. Thrown exceptions fail the task.
     */
    ExecutionResult execute(TaskMessage task) throws Exception;

    /**
     * Asks a run in progress to stop. Best effort; the run still reports a result.
     */
    default void cancel(String taskId) {
    }
}
