package dev.taskgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Set;

/**
 * Trigger policy config. mentionToken starts an explicit instruction ("@agent fix the build"),
 * triggerLabels is the label allow-list, slackReplayWindow bounds the accepted request age.
 */
@ConfigurationProperties(prefix = "taskgate.webhooks")
public record WebhookProperties(String mentionToken, Set<String> triggerLabels, Duration slackReplayWindow) {
    public WebhookProperties {
        if (mentionToken == null || mentionToken.isBlank()) mentionToken = "@agent";
        if (triggerLabels == null || triggerLabels.isEmpty())
            triggerLabels = Set.of("agent-review", "agent-fix", "agent-analyze");
        if (slackReplayWindow == null) slackReplayWindow = Duration.ofMinutes(5);
    }

    public static WebhookProperties defaults() {
        return new WebhookProperties(null, null, null);
    }
}
