package dev.taskgate.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Slack Events API envelope. Only {@code event_callback} envelopes carry an event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackWebhookPayload(
        String type,
        @JsonProperty("team_id") String teamId,
        @JsonProperty("event_id") String eventId,
        String challenge,
        Event event
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Event(
            String type,
            String subtype,
            String channel,
            @JsonProperty("channel_type") String channelType,
            String user,
            String text,
            String ts,
            @JsonProperty("thread_ts") String threadTs,
            @JsonProperty("bot_id") String botId,
            Message message
    ) {}

    /** Nested message of {@code message_changed} events. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String user, String text, String ts) {}

    public String eventType() {
        if ("event_callback".equals(type) && event != null && event.type() != null) return event.type();
        return type == null ? "unknown" : type;
    }
}
