package dev.taskgate.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sentry integration webhook body. Issue resources carry {@code data.issue}, event alerts
 * carry {@code data.event}, comment resources carry the comment fields directly on {@code data}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SentryWebhookPayload(String action, Installation installation, Data data, Actor actor) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Installation(String uuid) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Actor(String type, String id, String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
            Issue issue,
            Event event,
            @JsonProperty("comment_id") String commentId,
            @JsonProperty("issue_id") String issueId,
            @JsonProperty("project_slug") String projectSlug,
            String comment
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Issue(String id, String title, String culprit, String level, Project project,
                        IssueMetadata metadata) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Project(String slug, String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IssueMetadata(String type, String value, String filename, String function) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Event(@JsonProperty("event_id") String eventId, String title, String culprit, String level,
                        ExceptionData exception) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExceptionData(List<ExceptionValue> values) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExceptionValue(String type, String value) {}

    public String projectSlug() {
        if (data == null) return "";
        if (data.issue() != null && data.issue().project() != null && data.issue().project().slug() != null)
            return data.issue().project().slug();
        return data.projectSlug() == null ? "" : data.projectSlug();
    }
}
