package dev.taskgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * OAuth clients keyed by platform name ("jira", "slack"). One refresher is built per entry.
 */
@ConfigurationProperties(prefix = "taskgate.oauth")
public record OAuthProperties(Map<String, Client> clients) {
    public OAuthProperties {
        if (clients == null) clients = Map.of();
    }

    public record Client(String tokenUri, String clientId, String clientSecret) {}
}
