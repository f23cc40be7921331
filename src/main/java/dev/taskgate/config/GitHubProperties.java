package dev.taskgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * GitHub App credentials (installation tokens) and the OAuth client used by the
 * self-service install flow.
 */
@ConfigurationProperties(prefix = "taskgate.github")
public record GitHubProperties(long appId, String privateKey, String apiBaseUrl, OAuth oauth) {
    public GitHubProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) apiBaseUrl = "https://api.github.com";
        if (oauth == null) oauth = new OAuth(null, null, null, null, null, null);
    }

    /**
     * stateTtl bounds how long an authorize redirect stays redeemable.
     */
    public record OAuth(String clientId, String clientSecret, String authorizeUri, String tokenUri,
                        List<String> scopes, Duration stateTtl) {
        public OAuth {
            if (authorizeUri == null || authorizeUri.isBlank())
                authorizeUri = "https://github.com/login/oauth/authorize";
            if (tokenUri == null || tokenUri.isBlank()) tokenUri = "https://github.com/login/oauth/access_token";
            if (scopes == null || scopes.isEmpty()) scopes = List.of("repo", "read:org", "read:user");
            if (stateTtl == null) stateTtl = Duration.ofMinutes(10);
        }

        public boolean isConfigured() {
            return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
        }
    }
}
