package dev.taskgate.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a successful webhook response: either a queued task or a skip with its reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookOutcome(
        @JsonProperty("success") boolean success,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("skipped") boolean skipped,
        @JsonProperty("reason") String reason
) {
    public static final String SELF_POSTED = "self-posted";
    public static final String NO_TRIGGER = "no-trigger";

    public static WebhookOutcome queued(String taskId) {
        return new WebhookOutcome(true, taskId, false, null);
    }

    public static WebhookOutcome skipped(String reason) {
        return new WebhookOutcome(true, null, true, reason);
    }
}
