package dev.taskgate.dto.request;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record CreateInstallationRequest(
        String platform,
        String organizationId,
        String organizationName,
        String accessToken,
        String refreshToken,
        Instant tokenExpiresAt,
        Set<String> scopes,
        String webhookSecret,
        String installedBy,
        Map<String, String> metadata
) {}
