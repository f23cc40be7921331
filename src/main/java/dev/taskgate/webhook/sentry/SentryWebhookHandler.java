package dev.taskgate.webhook.sentry;

import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.valueobject.TaskRequest;
import dev.taskgate.domain.valueobject.WebhookEvent;
import dev.taskgate.dto.request.SentryWebhookPayload;
import dev.taskgate.webhook.JsonWebhookHandler;
import dev.taskgate.webhook.TriggerPolicy;
import dev.taskgate.webhook.WebhookSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Sentry integration platform webhooks, signed with a bare hex digest in
 * {@code Sentry-Hook-Signature}. The tenant is the issue's project slug.
 */
@Component
public class SentryWebhookHandler extends JsonWebhookHandler {
    private static final Logger log = LoggerFactory.getLogger(SentryWebhookHandler.class);

    public static final String PROVIDER = "sentry";
    static final String SIGNATURE_HEADER = "sentry-hook-signature";
    static final String RESOURCE_HEADER = "sentry-hook-resource";
    private static final String NEW_ISSUE_EVENT = "issue.created";

    private final Clock clock;

    public SentryWebhookHandler(ObjectMapper objectMapper, TriggerPolicy triggerPolicy, Clock clock) {
        super(objectMapper, triggerPolicy);
        this.clock = clock;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public boolean validate(byte[] rawBody, Map<String, String> headers, String secret) {
        String signature = header(headers, SIGNATURE_HEADER);
        if (signature == null) {
            log.warn("Sentry webhook missing {} header", SIGNATURE_HEADER);
            return false;
        }
        return WebhookSignatures.matches(secret, rawBody, "", signature);
    }

    @Override
    public WebhookEvent parse(byte[] rawBody, Map<String, String> headers) {
        SentryWebhookPayload payload = readPayload(rawBody, SentryWebhookPayload.class);
        String resource = header(headers, RESOURCE_HEADER);
        if (resource == null || resource.isBlank()) resource = "issue";
        String action = payload.action() == null || payload.action().isBlank() ? "unknown" : payload.action();

        String installationId = payload.installation() != null ? text(payload.installation().uuid()) : "";
        Map<String, String> metadata = extractMetadata(payload);
        String externalId = payload.data() != null ? payload.data().commentId() : null;
        String sender = payload.actor() != null ? payload.actor().name() : null;
        return new WebhookEvent(PROVIDER, resource + "." + action, installationId, payload.projectSlug(),
                externalId, sender, rawBody, Instant.now(clock), metadata);
    }

    @Override
    public boolean shouldProcess(WebhookEvent event) {
        if (!event.meta("comment_body").isEmpty()) return triggerPolicy.hasMention(event.meta("comment_body"));
        String level = event.meta("level").toLowerCase(Locale.ROOT);
        return NEW_ISSUE_EVENT.equals(event.eventType()) || level.equals("fatal") || level.equals("error");
    }

    @Override
    public TaskRequest buildTaskRequest(WebhookEvent event) {
        String input = triggerPolicy.extractInstruction(event.meta("comment_body"))
                .orElseGet(() -> describeError(event));
        return new TaskRequest(input, event.metadata(), priorityOf(event.meta("level")));
    }

    static TaskPriority priorityOf(String level) {
        return switch (level == null ? "" : level.toLowerCase(Locale.ROOT)) {
            case "fatal" -> TaskPriority.CRITICAL;
            case "error" -> TaskPriority.HIGH;
            default -> TaskPriority.NORMAL;
        };
    }

    static String describeError(WebhookEvent event) {
        StringBuilder sb = new StringBuilder("Sentry Error: ").append(event.meta("title"));
        if (!event.meta("error_type").isEmpty()) sb.append(" | Type: ").append(event.meta("error_type"));
        if (!event.meta("error_value").isEmpty()) sb.append(" | Value: ").append(event.meta("error_value"));
        if (!event.meta("culprit").isEmpty()) sb.append(" | Location: ").append(event.meta("culprit"));
        return sb.toString();
    }

    private static Map<String, String> extractMetadata(SentryWebhookPayload payload) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("organization_id", payload.projectSlug());
        metadata.put("action", text(payload.action()));
        SentryWebhookPayload.Data data = payload.data();
        if (data == null) return metadata;

        SentryWebhookPayload.Issue issue = data.issue();
        if (issue != null) {
            metadata.put("issue_id", text(issue.id()));
            metadata.put("title", text(issue.title()));
            metadata.put("culprit", text(issue.culprit()));
            metadata.put("level", issue.level() == null ? "error" : issue.level());
            if (issue.project() != null) metadata.put("project", text(issue.project().slug()));
            if (issue.metadata() != null) {
                metadata.put("error_type", text(issue.metadata().type()));
                metadata.put("error_value", text(issue.metadata().value()));
            }
        }
        SentryWebhookPayload.Event event = data.event();
        if (event != null) {
            metadata.putIfAbsent("title", text(event.title()));
            metadata.putIfAbsent("culprit", text(event.culprit()));
            metadata.putIfAbsent("level", event.level() == null ? "error" : event.level());
            put(metadata, "event_id", event.eventId());
            if (event.exception() != null && event.exception().values() != null
                    && !event.exception().values().isEmpty()) {
                SentryWebhookPayload.ExceptionValue first = event.exception().values().get(0);
                metadata.putIfAbsent("error_type", text(first.type()));
                metadata.putIfAbsent("error_value", text(first.value()));
            }
        }
        if (data.commentId() != null) {
            metadata.put("comment_id", data.commentId());
            metadata.put("comment_body", text(data.comment()));
            put(metadata, "issue_id", data.issueId());
            metadata.putIfAbsent("project", text(data.projectSlug()));
        }
        return metadata;
    }
}
