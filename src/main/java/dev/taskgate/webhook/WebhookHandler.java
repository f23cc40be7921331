package dev.taskgate.webhook;

import dev.taskgate.domain.valueobject.TaskRequest;
import dev.taskgate.domain.valueobject.WebhookEvent;

import java.util.Map;

/**
 * Provider-specific webhook logic. One implementation per provider, registered in the
 * {@link WebhookHandlerRegistry}; adding a provider = implement this + {@code @Component}.
 *
 * <p>Header maps passed to handlers always have lower-case keys.
 */
public interface WebhookHandler {

    /** Registry key and the platform name used for credential lookups, e.g. "github". */
    String provider();

    /**
     * Checks the request signature against the raw, unparsed body.
     * A missing signature header is invalid.
     */
    boolean validate(byte[] rawBody, Map<String, String> headers, String secret);

    /**
     * Parses the raw body into a normalized event. Pure: no I/O, no side effects.
     *
     * @throws dev.taskgate.exception.PayloadParseException if the body is not a valid payload
     */
    WebhookEvent parse(byte[] rawBody, Map<String, String> headers);

    /** Trigger policy: false means accepted but skipped. */
    boolean shouldProcess(WebhookEvent event);

    TaskRequest buildTaskRequest(WebhookEvent event);
}
