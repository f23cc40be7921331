package dev.taskgate.dto.response;

import dev.taskgate.domain.entity.Installation;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Admin view of an installation. Tokens and the webhook secret are never returned.
 */
public record InstallationResponse(
        UUID id, String platform, String organizationId, String organizationName,
        Set<String> scopes, Instant tokenExpiresAt, String installedBy,
        Map<String, String> metadata, boolean active, Instant createdAt, Instant updatedAt
) {
    public static InstallationResponse from(Installation i) {
        return new InstallationResponse(i.getId(), i.getPlatform(), i.getOrganizationId(),
                i.getOrganizationName(), Set.copyOf(i.getScopes()), i.getTokenExpiresAt(), i.getInstalledBy(),
                Map.copyOf(i.getMetadata()), i.isActive(), i.getCreatedAt(), i.getUpdatedAt());
    }
}
