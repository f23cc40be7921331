package dev.taskgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Token refresh config. A token counts as expired once expiresAt is at or before now + refreshSkew.
 */
@ConfigurationProperties(prefix = "taskgate.tokens")
public record TokenProperties(Duration refreshSkew, Duration retryBackoff) {
    public TokenProperties {
        if (refreshSkew == null) refreshSkew = Duration.ZERO;
        if (retryBackoff == null) retryBackoff = Duration.ofMillis(500);
    }

    public static TokenProperties defaults() {
        return new TokenProperties(null, null);
    }
}
