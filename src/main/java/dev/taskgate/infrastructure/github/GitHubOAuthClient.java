package dev.taskgate.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.taskgate.config.GitHubProperties;
import dev.taskgate.exception.OAuthFlowException;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * GitHub's web application flow: build the authorize URL, trade the callback code for a
 * user token, and look up who authorized.
 */
@Component
public class GitHubOAuthClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubOAuthClient.class);

    private final GitHubProperties.OAuth oauth;
    private final WebClient webClient;
    private final String apiBaseUrl;

    public GitHubOAuthClient(GitHubProperties properties) {
        this.oauth = properties.oauth();
        this.apiBaseUrl = properties.apiBaseUrl();
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(15))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    public String authorizationUrl(String redirectUri, String state) {
        requireConfigured();
        return UriComponentsBuilder.fromUriString(oauth.authorizeUri())
                .queryParam("client_id", "{clientId}")
                .queryParam("redirect_uri", "{redirectUri}")
                .queryParam("scope", "{scope}")
                .queryParam("state", "{state}")
                .encode()
                .buildAndExpand(oauth.clientId(), redirectUri, String.join(",", oauth.scopes()), state)
                .toUriString();
    }

    /**
     * GitHub reports a bad or expired code as HTTP 200 with an {@code error} field.
     *
     * @throws OAuthFlowException if GitHub refuses the code or cannot be reached
     */
    public AccessToken exchangeCode(String code) {
        requireConfigured();
        AccessToken token;
        try {
            token = webClient.post()
                    .uri(oauth.tokenUri())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromFormData("client_id", oauth.clientId())
                            .with("client_secret", oauth.clientSecret())
                            .with("code", code))
                    .retrieve()
                    .bodyToMono(AccessToken.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new OAuthFlowException("GitHub code exchange failed with HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientException | CodecException e) {
            throw new OAuthFlowException("GitHub code exchange failed", e);
        }
        if (token == null) throw new OAuthFlowException("GitHub returned an empty token response");
        if (token.error() != null) {
            log.warn("GitHub refused the authorization code: {} ({})", token.error(), token.errorDescription());
            throw new OAuthFlowException(token.error() + ": " + token.errorDescription());
        }
        if (token.accessToken() == null || token.accessToken().isBlank())
            throw new OAuthFlowException("GitHub returned no access_token");
        log.info("Exchanged GitHub authorization code");
        return token;
    }

    public User fetchUser(String accessToken) {
        try {
            User user = webClient.get()
                    .uri(apiBaseUrl + "/user")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .header(HttpHeaders.ACCEPT, "application/vnd.github+json")
                    .retrieve()
                    .bodyToMono(User.class)
                    .block();
            if (user == null || user.login() == null) throw new OAuthFlowException("GitHub returned no user");
            return user;
        } catch (WebClientResponseException e) {
            throw new OAuthFlowException("Failed to fetch GitHub user: HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientException | CodecException e) {
            throw new OAuthFlowException("Failed to fetch GitHub user", e);
        }
    }

    private void requireConfigured() {
        if (!oauth.isConfigured()) throw new OAuthFlowException("GitHub OAuth client is not configured");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AccessToken(@JsonProperty("access_token") String accessToken,
                              @JsonProperty("refresh_token") String refreshToken,
                              @JsonProperty("expires_in") Long expiresIn,
                              @JsonProperty("scope") String scope,
                              @JsonProperty("error") String error,
                              @JsonProperty("error_description") String errorDescription) {

        public Set<String> scopes() {
            if (scope == null || scope.isBlank()) return Set.of();
            return Arrays.stream(scope.split("[\\s,]+")).filter(s -> !s.isEmpty()).collect(Collectors.toSet());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(Long id, String login, String email) {}
}
