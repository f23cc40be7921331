package dev.taskgate.infrastructure.oauth;

import dev.taskgate.config.OAuthProperties;
import dev.taskgate.domain.entity.Installation;
import dev.taskgate.domain.valueobject.TokenInfo;
import dev.taskgate.exception.TokenRefreshException;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Standard OAuth 2 {@code refresh_token} grant against one provider's token endpoint.
 * One instance per configured client, see {@link TokenRefresherRegistry}.
 */
public class OAuthTokenRefresher implements PlatformTokenRefresher {
    private static final Logger log = LoggerFactory.getLogger(OAuthTokenRefresher.class);

    private final String platform;
    private final OAuthProperties.Client client;
    private final WebClient webClient;
    private final Clock clock;

    public OAuthTokenRefresher(String platform, OAuthProperties.Client client, Clock clock) {
        this.platform = platform;
        this.client = client;
        this.clock = clock;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(15))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String platform() {
        return platform;
    }

    @Override
    public TokenInfo refresh(Installation installation) {
        String refreshToken = installation.getRefreshToken();
        if (refreshToken == null || refreshToken.isBlank())
            throw new TokenRefreshException("No refresh token stored for %s/%s"
                    .formatted(platform, installation.getOrganizationId()), true);

        OAuthTokenResponse response;
        try {
            response = webClient.post()
                    .uri(client.tokenUri())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromFormData("grant_type", "refresh_token")
                            .with("refresh_token", refreshToken)
                            .with("client_id", client.clientId())
                            .with("client_secret", client.clientSecret()))
                    .retrieve()
                    .bodyToMono(OAuthTokenResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            boolean permanent = isPermanent(e.getStatusCode().value());
            log.warn("{} token endpoint answered {} for org {}", platform, e.getStatusCode().value(),
                    installation.getOrganizationId());
            throw new TokenRefreshException("%s refresh rejected with HTTP %d"
                    .formatted(platform, e.getStatusCode().value()), permanent, e);
        } catch (WebClientRequestException e) {
            throw new TokenRefreshException(platform + " token endpoint unreachable", false, e);
        } catch (WebClientException | CodecException e) {
            throw new TokenRefreshException(platform + " token endpoint returned an unreadable response", false, e);
        }

        if (response == null || response.accessToken() == null || response.accessToken().isBlank())
            throw new TokenRefreshException(platform + " token endpoint returned no access_token", false);

        Instant expiresAt = response.expiresIn() == null ? null : clock.instant().plusSeconds(response.expiresIn());
        log.info("Refreshed {} token for org {} (expires {})", platform, installation.getOrganizationId(), expiresAt);
        return new TokenInfo(response.accessToken(), response.refreshToken(), expiresAt, parseScopes(response.scope()));
    }

    static boolean isPermanent(int status) {
        return status == HttpStatus.BAD_REQUEST.value() || status == HttpStatus.UNAUTHORIZED.value();
    }

    private static Set<String> parseScopes(String scope) {
        if (scope == null || scope.isBlank()) return Set.of();
        return Arrays.stream(scope.split("[\\s,]+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }
}
