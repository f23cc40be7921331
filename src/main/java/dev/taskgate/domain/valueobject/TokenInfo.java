package dev.taskgate.domain.valueobject;

import java.time.Instant;
import java.util.Set;

/**
 * Access credentials for one installation. refreshToken and expiresAt are optional:
 * a null expiresAt never expires.
 */
public record TokenInfo(String accessToken, String refreshToken, Instant expiresAt, Set<String> scopes) {
    public TokenInfo {
        if (accessToken == null || accessToken.isBlank())
            throw new IllegalArgumentException("accessToken required");
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public boolean isExpiredAt(Instant instant) {
        return expiresAt != null && !expiresAt.isAfter(instant);
    }
}
