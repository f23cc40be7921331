package dev.taskgate.webhook.jira;

import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.valueobject.TaskRequest;
import dev.taskgate.domain.valueobject.WebhookEvent;
import dev.taskgate.dto.request.JiraWebhookPayload;
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
import java.util.Set;

/**
 * Jira Cloud webhooks, signed with {@code X-Hub-Signature: sha256=<hex>}.
 * The tenant is the Jira project key.
 */
@Component
public class JiraWebhookHandler extends JsonWebhookHandler {
    private static final Logger log = LoggerFactory.getLogger(JiraWebhookHandler.class);

    public static final String PROVIDER = "jira";
    static final String SIGNATURE_HEADER = "x-hub-signature";

    private static final Map<String, TaskPriority> PRIORITY_MAP = Map.of(
            "highest", TaskPriority.CRITICAL,
            "high", TaskPriority.HIGH,
            "medium", TaskPriority.NORMAL,
            "low", TaskPriority.LOW,
            "lowest", TaskPriority.LOW);
    private static final Set<String> CREATED_EVENTS = Set.of("jira:issue_created", "issue_created");

    private final Clock clock;

    public JiraWebhookHandler(ObjectMapper objectMapper, TriggerPolicy triggerPolicy, Clock clock) {
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
            log.warn("Jira webhook missing {} header", SIGNATURE_HEADER);
            return false;
        }
        return WebhookSignatures.matches(secret, rawBody, "sha256=", signature);
    }

    @Override
    public WebhookEvent parse(byte[] rawBody, Map<String, String> headers) {
        JiraWebhookPayload payload = readPayload(rawBody, JiraWebhookPayload.class);
        String installationId = payload.user() != null ? text(payload.user().accountId()) : "";
        String externalId = payload.comment() != null ? payload.comment().id() : null;
        String sender = payload.comment() != null && payload.comment().author() != null
                ? payload.comment().author().displayName()
                : payload.user() != null ? payload.user().displayName() : null;
        return new WebhookEvent(PROVIDER, payload.eventType(), installationId, payload.projectKey(),
                externalId, sender, rawBody, Instant.now(clock), extractMetadata(payload));
    }

    @Override
    public boolean shouldProcess(WebhookEvent event) {
        if ("app".equalsIgnoreCase(event.meta("comment_author_type"))) {
            log.debug("Ignoring Jira comment {} authored by an app account", event.externalId());
            return false;
        }
        return triggerPolicy.hasMention(event.meta("comment_body"), event.meta("description"))
                || triggerPolicy.hasTriggerLabel(event.meta("labels"))
                || isAssignedToAgent(event)
                || isCritical(event);
    }

    @Override
    public TaskRequest buildTaskRequest(WebhookEvent event) {
        String input = triggerPolicy.extractInstruction(event.meta("comment_body"), event.meta("description"))
                .orElseGet(() -> defaultInstruction(event));
        return new TaskRequest(input, event.metadata(), priorityOf(event.meta("priority")));
    }

    static TaskPriority priorityOf(String jiraPriority) {
        String key = jiraPriority == null || jiraPriority.isBlank() ? "medium" : jiraPriority.toLowerCase(Locale.ROOT);
        return PRIORITY_MAP.getOrDefault(key, TaskPriority.NORMAL);
    }

    private static boolean isAssignedToAgent(WebhookEvent event) {
        String assignee = event.meta("assignee").toLowerCase(Locale.ROOT);
        return assignee.contains("agent") || assignee.contains("bot");
    }

    private static boolean isCritical(WebhookEvent event) {
        String priority = event.meta("priority").toLowerCase(Locale.ROOT);
        return priority.equals("highest") || priority.equals("high")
                || event.meta("issue_type").equalsIgnoreCase("incident");
    }

    private static String defaultInstruction(WebhookEvent event) {
        if (CREATED_EVENTS.contains(event.eventType()))
            return "Analyze issue %s: %s".formatted(event.meta("issue_key"), event.meta("summary"));
        if ("comment_created".equals(event.eventType()))
            return "Respond to comment on " + event.meta("issue_key");
        return "Process " + event.eventType();
    }

    private Map<String, String> extractMetadata(JiraWebhookPayload payload) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("organization_id", payload.projectKey());
        JiraWebhookPayload.Issue issue = payload.issue();
        if (issue != null) {
            metadata.put("issue_key", text(issue.key()));
            metadata.put("issue_id", text(issue.id()));
            JiraWebhookPayload.Fields fields = issue.fields();
            if (fields != null) {
                metadata.put("summary", text(fields.summary()));
                metadata.put("description", fields.description() instanceof String s ? s : "");
                metadata.put("issue_type", fields.issuetype() != null ? text(fields.issuetype().name()) : "");
                metadata.put("status", fields.status() != null ? text(fields.status().name()) : "");
                metadata.put("priority", fields.priority() != null ? text(fields.priority().name()) : "Medium");
                if (fields.assignee() != null) metadata.put("assignee", text(fields.assignee().displayName()));
                if (fields.project() != null) {
                    metadata.put("project_key", text(fields.project().key()));
                    metadata.put("project_name", text(fields.project().name()));
                }
                metadata.put("labels", joinLabels(fields.labels()));
            }
        }
        JiraWebhookPayload.Comment comment = payload.comment();
        if (comment != null) {
            put(metadata, "comment_id", comment.id());
            metadata.put("comment_body", text(comment.body()));
            if (comment.author() != null) {
                metadata.put("comment_author", text(comment.author().displayName()));
                metadata.put("comment_author_type", text(comment.author().accountType()));
            }
        }
        return metadata;
    }
}
