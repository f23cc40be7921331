package dev.taskgate.webhook;

import dev.taskgate.exception.PayloadParseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Base for handlers whose providers post JSON bodies.
 */
public abstract class JsonWebhookHandler implements WebhookHandler {

    protected final ObjectMapper objectMapper;
    protected final TriggerPolicy triggerPolicy;

    protected JsonWebhookHandler(ObjectMapper objectMapper, TriggerPolicy triggerPolicy) {
        this.objectMapper = objectMapper;
        this.triggerPolicy = triggerPolicy;
    }

    protected <T> T readPayload(byte[] rawBody, Class<T> type) {
        if (rawBody == null || rawBody.length == 0)
            throw new PayloadParseException(provider(), "Empty body");
        T payload;
        try {
            payload = objectMapper.readValue(rawBody, type);
        } catch (JacksonException e) {
            throw new PayloadParseException(provider(), "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (payload == null) throw new PayloadParseException(provider(), "Empty payload");
        return payload;
    }

    protected static String header(Map<String, String> headers, String name) {
        return headers == null ? null : headers.get(name);
    }

    protected static void put(Map<String, String> metadata, String key, Object value) {
        if (value != null) metadata.put(key, String.valueOf(value));
    }

    protected static String text(String value) {
        return value == null ? "" : value;
    }

    protected static String joinLabels(Collection<String> labels) {
        if (labels == null) return "";
        return labels.stream().filter(Objects::nonNull).collect(Collectors.joining(","));
    }
}
