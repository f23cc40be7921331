package dev.taskgate.domain.valueobject;

import java.time.Instant;
import java.util.Map;

/**
 * Normalized inbound signal. Built per request by a handler and never persisted;
 * whatever a task needs is carried forward in its source metadata.
 *
 * @param externalId provider id of the triggering comment/message, checked by the loop guard
 * @param sender     login or user id of whoever caused the event
 */
public record WebhookEvent(
        String provider,
        String eventType,
        String installationId,
        String organizationId,
        String externalId,
        String sender,
        byte[] rawPayload,
        Instant timestamp,
        Map<String, String> metadata
) {
    public WebhookEvent {
        if (provider == null) throw new IllegalArgumentException("provider required");
        if (eventType == null) eventType = "unknown";
        if (organizationId == null) organizationId = "";
        if (timestamp == null) timestamp = Instant.now();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String meta(String key) {
        return metadata.getOrDefault(key, "");
    }
}
