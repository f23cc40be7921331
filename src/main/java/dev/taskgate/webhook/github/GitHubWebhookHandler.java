package dev.taskgate.webhook.github;

import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.valueobject.TaskRequest;
import dev.taskgate.domain.valueobject.WebhookEvent;
import dev.taskgate.dto.request.GitHubWebhookPayload;
import dev.taskgate.webhook.JsonWebhookHandler;
import dev.taskgate.webhook.TriggerPolicy;
import dev.taskgate.webhook.WebhookSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GitHub App webhooks. Signature: {@code X-Hub-Signature-256: sha256=<hex>}.
 * Pull requests opened are reviewed by default; comments need the mention token.
 */
@Component
public class GitHubWebhookHandler extends JsonWebhookHandler {
    private static final Logger log = LoggerFactory.getLogger(GitHubWebhookHandler.class);

    public static final String PROVIDER = "github";
    static final String SIGNATURE_HEADER = "x-hub-signature-256";
    static final String EVENT_HEADER = "x-github-event";
    private static final String AUTO_REVIEW_EVENT = "pull_request.opened";

    private final Clock clock;

    public GitHubWebhookHandler(ObjectMapper objectMapper, TriggerPolicy triggerPolicy, Clock clock) {
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
            log.warn("GitHub webhook missing {} header", SIGNATURE_HEADER);
            return false;
        }
        return WebhookSignatures.matches(secret, rawBody, "sha256=", signature);
    }

    @Override
    public WebhookEvent parse(byte[] rawBody, Map<String, String> headers) {
        GitHubWebhookPayload payload = readPayload(rawBody, GitHubWebhookPayload.class);

        String eventType = header(headers, EVENT_HEADER);
        if (eventType == null || eventType.isBlank()) eventType = "unknown";
        String fullEvent = payload.action() != null && !payload.action().isBlank()
                ? eventType + "." + payload.action() : eventType;

        String installationId = payload.installation() != null && payload.installation().id() != null
                ? String.valueOf(payload.installation().id()) : "";
        String externalId = payload.comment() != null && payload.comment().id() != null
                ? String.valueOf(payload.comment().id()) : null;
        String sender = payload.sender() != null ? payload.sender().login() : null;

        return new WebhookEvent(PROVIDER, fullEvent, installationId, payload.organization(),
                externalId, sender, rawBody, Instant.now(clock), extractMetadata(payload));
    }

    @Override
    public boolean shouldProcess(WebhookEvent event) {
        if (isBotSender(event.meta("sender"), event.meta("sender_type"))) {
            log.debug("Ignoring GitHub event {} from bot {}", event.eventType(), event.sender());
            return false;
        }
        return triggerPolicy.hasMention(event.meta("comment_body"), event.meta("pr_body"))
                || triggerPolicy.hasTriggerLabel(event.meta("labels"))
                || AUTO_REVIEW_EVENT.equals(event.eventType());
    }

    @Override
    public TaskRequest buildTaskRequest(WebhookEvent event) {
        String input = triggerPolicy.extractInstruction(event.meta("comment_body"), event.meta("pr_body"))
                .orElseGet(() -> AUTO_REVIEW_EVENT.equals(event.eventType())
                        ? "Review PR #%s: %s".formatted(event.meta("pr_number"), event.meta("pr_title"))
                        : "Process " + event.eventType());
        return new TaskRequest(input, event.metadata(), priorityOf(event.meta("labels")));
    }

    static boolean isBotSender(String login, String type) {
        if ("bot".equalsIgnoreCase(type)) return true;
        return login != null && login.toLowerCase(Locale.ROOT).endsWith("[bot]");
    }

    static TaskPriority priorityOf(String labelsCsv) {
        String labels = labelsCsv.toLowerCase(Locale.ROOT);
        if (labels.contains("critical")) return TaskPriority.CRITICAL;
        if (labels.contains("urgent")) return TaskPriority.HIGH;
        return TaskPriority.NORMAL;
    }

    private Map<String, String> extractMetadata(GitHubWebhookPayload payload) {
        Map<String, String> metadata = new HashMap<>();
        List<String> labels = new ArrayList<>();

        put(metadata, "action", payload.action());
        put(metadata, "organization_id", payload.organization());
        metadata.put("repo", payload.repository() != null ? text(payload.repository().fullName()) : "");

        GitHubWebhookPayload.PullRequest pr = payload.pullRequest();
        if (pr != null) {
            put(metadata, "pr_number", pr.number());
            metadata.put("pr_title", text(pr.title()));
            metadata.put("pr_body", text(pr.body()));
            if (pr.head() != null) {
                metadata.put("head_ref", text(pr.head().ref()));
                metadata.put("head_sha", text(pr.head().sha()));
            }
            addLabels(labels, pr.labels());
        }

        GitHubWebhookPayload.Issue issue = payload.issue();
        if (issue != null) {
            put(metadata, "issue_number", issue.number());
            metadata.put("issue_title", text(issue.title()));
            // Comments on pull requests arrive as issue_comment with issue.pull_request set
            if (!metadata.containsKey("pr_number") && issue.pullRequest() != null)
                put(metadata, "pr_number", issue.number());
            addLabels(labels, issue.labels());
        }

        if (payload.comment() != null) {
            put(metadata, "comment_id", payload.comment().id());
            metadata.put("comment_body", text(payload.comment().body()));
        }
        if (payload.label() != null && payload.label().name() != null) {
            labels.add(payload.label().name());
        }
        if (payload.sender() != null) {
            metadata.put("sender", text(payload.sender().login()));
            metadata.put("sender_type", text(payload.sender().type()));
        }
        metadata.put("labels", joinLabels(labels.stream().distinct().toList()));
        return metadata;
    }

    private static void addLabels(List<String> target, List<GitHubWebhookPayload.Label> labels) {
        if (labels == null) return;
        labels.stream().map(GitHubWebhookPayload.Label::name).filter(n -> n != null && !n.isBlank()).forEach(target::add);
    }
}
