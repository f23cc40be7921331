package dev.taskgate.service;

import dev.taskgate.config.GitHubProperties;
import dev.taskgate.domain.entity.Installation;
import dev.taskgate.dto.request.CreateInstallationRequest;
import dev.taskgate.exception.OAuthFlowException;
import dev.taskgate.infrastructure.github.GitHubAppTokenRefresher;
import dev.taskgate.infrastructure.github.GitHubOAuthClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Self-service GitHub onboarding. The first successful authorization of a user creates
 * their installation with a freshly generated webhook secret; the secret is handed back
 * once, on the redirect to the caller.
 *
 * <p>The installation is keyed by the GitHub login, which is what repository-owner
 * lookups on incoming webhooks resolve to.
 */
@Service
public class GitHubInstallService {
    private static final Logger log = LoggerFactory.getLogger(GitHubInstallService.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final GitHubOAuthClient client;
    private final TokenService tokenService;
    private final GitHubProperties.OAuth oauth;
    private final Clock clock;

    public GitHubInstallService(GitHubOAuthClient client, TokenService tokenService, GitHubProperties properties,
                                Clock clock) {
        this.client = client;
        this.tokenService = tokenService;
        this.oauth = properties.oauth();
        this.clock = clock;
    }

    public AuthorizationRequest authorize(String redirectUri) {
        requireConfigured();
        requireHttpUri(redirectUri);
        String state = OAuthState.issue(redirectUri, clock.instant()).encode(oauth.clientSecret());
        log.info("GitHub authorization started, redirect={}", redirectUri);
        return new AuthorizationRequest(client.authorizationUrl(redirectUri, state), state);
    }

    /**
     * @param githubInstallationId the App installation id GitHub appends when the user also
     *                             installed the App; null for a plain OAuth authorization
     * @throws OAuthFlowException if the state is invalid or GitHub refuses the code
     */
    public InstallResult complete(String code, String state, String githubInstallationId) {
        requireConfigured();
        if (code == null || code.isBlank()) throw new OAuthFlowException("Missing authorization code");
        OAuthState decoded = OAuthState.decode(state, oauth.clientSecret(), clock.instant(), oauth.stateTtl());

        GitHubOAuthClient.AccessToken token = client.exchangeCode(code);
        GitHubOAuthClient.User user = client.fetchUser(token.accessToken());

        String webhookSecret = generateWebhookSecret();
        Instant expiresAt = token.expiresIn() == null ? null : clock.instant().plusSeconds(token.expiresIn());
        Map<String, String> metadata = githubInstallationId == null || githubInstallationId.isBlank()
                ? Map.of()
                : Map.of(GitHubAppTokenRefresher.INSTALLATION_ID_KEY, githubInstallationId);
        String installedBy = user.email() == null || user.email().isBlank() ? user.login() : user.email();

        Installation installation = tokenService.createInstallation(new CreateInstallationRequest(
                "github", user.login(), user.login(), token.accessToken(), token.refreshToken(), expiresAt,
                token.scopes(), webhookSecret, installedBy, metadata));
        log.info("GitHub installation {} created for {}", installation.getId(), user.login());

        String redirect = UriComponentsBuilder.fromUriString(decoded.redirectUri())
                .queryParam("installation_id", installation.getId())
                .queryParam("webhook_secret", webhookSecret)
                .build()
                .toUriString();
        return new InstallResult(installation, webhookSecret, redirect);
    }

    /** 32 random bytes, hex encoded. */
    static String generateWebhookSecret() {
        byte[] secret = new byte[32];
        RANDOM.nextBytes(secret);
        return HexFormat.of().formatHex(secret);
    }

    private void requireConfigured() {
        if (!oauth.isConfigured()) throw new OAuthFlowException("GitHub OAuth client is not configured");
    }

    private static void requireHttpUri(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()) throw new IllegalArgumentException("redirect_uri is required");
        URI uri;
        try {
            uri = URI.create(redirectUri);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("redirect_uri is not a valid URI", e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if ((!scheme.equals("https") && !scheme.equals("http")) || uri.getHost() == null)
            throw new IllegalArgumentException("redirect_uri must be an absolute http(s) URI");
    }

    public record AuthorizationRequest(String authorizationUrl, String state) {}

    public record InstallResult(Installation installation, String webhookSecret, String redirectUri) {}
}
