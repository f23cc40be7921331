package dev.taskgate.worker;

import dev.taskgate.domain.valueobject.TaskMessage;

import java.util.Optional;

/**
 * Posts a finished task's output back to where the task came from (PR comment, Slack
 * thread, ...). Optional collaborator.
 */
public interface ResultPoster {

    /**
     * @return the provider's id of the posted comment/message, recorded in the loop guard
     *         so the webhook it triggers is ignored
     */
    Optional<String> post(TaskMessage task, ExecutionResult result);
}
