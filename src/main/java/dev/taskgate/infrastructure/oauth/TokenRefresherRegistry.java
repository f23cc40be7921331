package dev.taskgate.infrastructure.oauth;

import dev.taskgate.config.OAuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Refreshers by platform: one {@link OAuthTokenRefresher} per configured OAuth client plus
 * every {@link PlatformTokenRefresher} bean. A bean wins over a configured client.
 */
@Component
public class TokenRefresherRegistry {
    private static final Logger log = LoggerFactory.getLogger(TokenRefresherRegistry.class);

    private final Map<String, PlatformTokenRefresher> refreshers = new HashMap<>();

    public TokenRefresherRegistry(OAuthProperties oauthProperties, List<PlatformTokenRefresher> beans, Clock clock) {
        oauthProperties.clients().forEach((platform, client) -> {
            String key = platform.toLowerCase(Locale.ROOT);
            refreshers.put(key, new OAuthTokenRefresher(key, client, clock));
        });
        beans.forEach(r -> refreshers.put(r.platform().toLowerCase(Locale.ROOT), r));
        log.info("Token refreshers available for {}", refreshers.keySet());
    }

    public Optional<PlatformTokenRefresher> find(String platform) {
        if (platform == null) return Optional.empty();
        return Optional.ofNullable(refreshers.get(platform.toLowerCase(Locale.ROOT)));
    }
}
