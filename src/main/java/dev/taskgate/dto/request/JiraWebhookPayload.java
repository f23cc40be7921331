package dev.taskgate.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraWebhookPayload(
        String webhookEvent,
        @JsonProperty("issue_event_type_name") String issueEventTypeName,
        User user,
        Issue issue,
        Comment comment
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String accountId, String displayName, String accountType) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Issue(String id, String key, Fields fields) {}
    /** description is a plain string in v2 payloads and an ADF document in v3 ones. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Fields(String summary, Object description, Named issuetype, Named status,
                         Named priority, User assignee, Project project, List<String> labels) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Named(String name) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Project(String key, String name) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Comment(String id, String body, User author) {}

    public String eventType() {
        if (issueEventTypeName != null && !issueEventTypeName.isBlank()) return issueEventTypeName;
        return webhookEvent != null && !webhookEvent.isBlank() ? webhookEvent : "unknown";
    }

    public String projectKey() {
        if (issue == null || issue.fields() == null || issue.fields().project() == null) return "";
        String key = issue.fields().project().key();
        return key == null ? "" : key;
    }
}
