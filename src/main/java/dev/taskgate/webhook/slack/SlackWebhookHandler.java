package dev.taskgate.webhook.slack;

import dev.taskgate.config.WebhookProperties;
import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.valueobject.TaskRequest;
import dev.taskgate.domain.valueobject.WebhookEvent;
import dev.taskgate.dto.request.SlackWebhookPayload;
import dev.taskgate.exception.PayloadParseException;
import dev.taskgate.webhook.JsonWebhookHandler;
import dev.taskgate.webhook.TriggerPolicy;
import dev.taskgate.webhook.WebhookSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Slack Events API. Requests are signed over {@code v0:<timestamp>:<body>} and carry the
 * timestamp separately, so stale timestamps are rejected as replays.
 */
@Component
public class SlackWebhookHandler extends JsonWebhookHandler {
    private static final Logger log = LoggerFactory.getLogger(SlackWebhookHandler.class);

    public static final String PROVIDER = "slack";
    static final String TIMESTAMP_HEADER = "x-slack-request-timestamp";
    static final String SIGNATURE_HEADER = "x-slack-signature";
    static final String FALLBACK_INPUT = "How can I help you?";

    private static final Pattern USER_MENTION = Pattern.compile("<@[UW][A-Z0-9]+>", Pattern.CASE_INSENSITIVE);

    private final Clock clock;
    private final Duration replayWindow;

    public SlackWebhookHandler(ObjectMapper objectMapper, TriggerPolicy triggerPolicy,
                               WebhookProperties properties, Clock clock) {
        super(objectMapper, triggerPolicy);
        this.clock = clock;
        this.replayWindow = properties.slackReplayWindow();
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public boolean validate(byte[] rawBody, Map<String, String> headers, String secret) {
        String timestamp = header(headers, TIMESTAMP_HEADER);
        String signature = header(headers, SIGNATURE_HEADER);
        if (timestamp == null || signature == null) {
            log.warn("Slack webhook missing signature headers");
            return false;
        }
        long epochSeconds;
        try {
            epochSeconds = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            log.warn("Slack webhook timestamp is not numeric: {}", timestamp);
            return false;
        }
        Duration age = Duration.between(Instant.ofEpochSecond(epochSeconds), Instant.now(clock)).abs();
        if (age.compareTo(replayWindow) > 0) {
            log.warn("Slack webhook timestamp outside replay window: age={}s", age.toSeconds());
            return false;
        }
        return WebhookSignatures.matches(secret, baseString(timestamp.trim(), rawBody), "v0=", signature);
    }

    @Override
    public WebhookEvent parse(byte[] rawBody, Map<String, String> headers) {
        SlackWebhookPayload payload = readPayload(rawBody, SlackWebhookPayload.class);
        if ("url_verification".equals(payload.type()))
            throw new PayloadParseException(PROVIDER, "url_verification challenge is not an event");

        Map<String, String> metadata = extractMetadata(payload);
        String teamId = text(payload.teamId());
        String externalId = metadata.get("ts");
        return new WebhookEvent(PROVIDER, payload.eventType(), teamId, teamId,
                externalId == null || externalId.isEmpty() ? null : externalId,
                metadata.get("user"), rawBody, Instant.now(clock), metadata);
    }

    @Override
    public boolean shouldProcess(WebhookEvent event) {
        if (!event.meta("bot_id").isEmpty()) {
            log.debug("Ignoring Slack message {} posted by bot {}", event.externalId(), event.meta("bot_id"));
            return false;
        }
        String text = event.meta("text");
        return USER_MENTION.matcher(text).find()
                || triggerPolicy.hasMention(text)
                || "im".equals(event.meta("channel_type"));
    }

    @Override
    public TaskRequest buildTaskRequest(WebhookEvent event) {
        return new TaskRequest(inputOf(event.meta("text")), event.metadata(), priorityOf(event));
    }

    String inputOf(String text) {
        String stripped = USER_MENTION.matcher(text).replaceAll("");
        stripped = Pattern.compile(Pattern.quote(triggerPolicy.mentionToken()), Pattern.CASE_INSENSITIVE)
                .matcher(stripped).replaceAll("")
                .strip();
        return stripped.isEmpty() ? FALLBACK_INPUT : stripped;
    }

    static TaskPriority priorityOf(WebhookEvent event) {
        if ("im".equals(event.meta("channel_type"))) return TaskPriority.HIGH;
        if (!event.meta("thread_ts").isEmpty()) return TaskPriority.NORMAL;
        return TaskPriority.LOW;
    }

    private static byte[] baseString(String timestamp, byte[] rawBody) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(rawBody.length + 32);
        out.writeBytes(("v0:" + timestamp + ":").getBytes(StandardCharsets.UTF_8));
        out.writeBytes(rawBody);
        return out.toByteArray();
    }

    private static Map<String, String> extractMetadata(SlackWebhookPayload payload) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("organization_id", text(payload.teamId()));
        SlackWebhookPayload.Event event = payload.event();
        if (event == null) return metadata;
        metadata.put("channel", text(event.channel()));
        metadata.put("channel_type", text(event.channelType()));
        metadata.put("user", text(event.user()));
        metadata.put("text", text(event.text()));
        metadata.put("ts", text(event.ts()));
        metadata.put("thread_ts", text(event.threadTs()));
        if (event.message() != null) {
            metadata.put("text", text(event.message().text()));
            metadata.put("user", text(event.message().user()));
        }
        if (event.botId() != null && !event.botId().isEmpty()) metadata.put("bot_id", event.botId());
        return metadata;
    }
}
