package dev.taskgate.support;

import dev.taskgate.config.WebhookProperties;
import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.webhook.TriggerPolicy;
import dev.taskgate.webhook.WebhookSignatures;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

public final class Fixtures {
    public static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private Fixtures() {
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder().build();
    }

    public static TriggerPolicy triggerPolicy() {
        return new TriggerPolicy(WebhookProperties.defaults());
    }

    public static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    public static String githubSignature(String secret, byte[] body) {
        return "sha256=" + WebhookSignatures.hmacSha256Hex(secret, body);
    }

    public static TaskMessage message(String taskId, TaskPriority priority) {
        return new TaskMessage(taskId, "inst-1", "github", "do " + taskId, priority, Map.of(), NOW);
    }

    public static String prOpenedPayload() {
        return prOpenedPayload("Implements the thing");
    }

    public static String prOpenedPayload(String prBody) {
        return """
                {
                  "action": "opened",
                  "pull_request": {
                    "number": 42,
                    "title": "Add cool feature",
                    "body": "%s",
                    "head": { "sha": "abc123", "ref": "feature/cool" },
                    "labels": []
                  },
                  "repository": { "full_name": "octocat/hello-world", "owner": { "login": "octocat", "type": "Organization" } },
                  "installation": { "id": 12345 },
                  "sender": { "login": "alice", "type": "User" }
                }
                """.formatted(prBody);
    }

    public static String issueCommentPayload(long commentId, String body, String senderLogin, String senderType) {
        return issueCommentPayload(7, commentId, body, senderLogin, senderType);
    }

    public static String issueCommentPayload(int issueNumber, long commentId, String body,
                                             String senderLogin, String senderType) {
        return """
                {
                  "action": "created",
                  "issue": {
                    "number": %d,
                    "title": "Flaky test",
                    "pull_request": { "url": "https://api.github.com/repos/octocat/hello-world/pulls/7" },
                    "labels": [ { "name": "urgent" } ]
                  },
                  "comment": { "id": %d, "body": "%s", "user": { "login": "%s", "type": "%s" } },
                  "repository": { "full_name": "octocat/hello-world", "owner": { "login": "octocat", "type": "Organization" } },
                  "installation": { "id": 12345 },
                  "sender": { "login": "%s", "type": "%s" }
                }
                """.formatted(issueNumber, commentId, body, senderLogin, senderType, senderLogin, senderType);
    }
}
