package dev.taskgate.infrastructure.oauth;

import dev.taskgate.domain.entity.Installation;
import dev.taskgate.domain.valueobject.TokenInfo;

/**
 * Obtains a fresh token for one platform. Implementations call the provider and never
 * touch the database.
 */
public interface PlatformTokenRefresher {

    String platform();

    /**
     * @throws dev.taskgate.exception.TokenRefreshException on failure; permanent when the
     *         grant is revoked or the credentials are rejected
     */
    TokenInfo refresh(Installation installation);
}
