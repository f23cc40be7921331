package dev.taskgate.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubWebhookPayload(
        String action,
        @JsonProperty("pull_request") PullRequest pullRequest,
        Issue issue,
        Comment comment,
        Repository repository,
        Installation installation,
        User sender,
        Label label
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(Long number, String title, String body, Head head, List<Label> labels) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(String sha, String ref) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Issue(Long number, String title, String body,
                        @JsonProperty("pull_request") Map<String, Object> pullRequest,
                        List<Label> labels) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Comment(Long id, String body, User user) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("full_name") String fullName, User owner) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Installation(Long id) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String login, String type) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Label(String name) {}

    public String organization() {
        if (repository == null) return "";
        if (repository.owner() != null && repository.owner().login() != null) return repository.owner().login();
        String fullName = repository.fullName();
        return fullName != null && fullName.contains("/") ? fullName.substring(0, fullName.indexOf('/')) : "";
    }
}
