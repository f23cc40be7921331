package dev.taskgate.webhook;

import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.domain.valueobject.TaskRequest;
import dev.taskgate.domain.valueobject.WebhookEvent;
import dev.taskgate.exception.QueueUnavailableException;
import dev.taskgate.exception.SignatureValidationException;
import dev.taskgate.exception.UnknownProviderException;
import dev.taskgate.loopguard.LoopGuard;
import dev.taskgate.queue.TaskPublisher;
import dev.taskgate.service.TaskLifecycleService;
import dev.taskgate.service.TokenService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Inbound pipeline for one webhook delivery:
 * <pre>
 * handler lookup → parse (locates tenant) → tenant secret → signature check
 *   → loop guard → trigger policy → TaskRecord(QUEUED) → enqueue
 * </pre>
 *
 * <p>The signature is always checked against the raw bytes, never a re-serialization.
 * Failures surface as the typed exceptions the HTTP layer maps to status codes.
 */
@Service
public class WebhookRouter {
    private static final Logger log = LoggerFactory.getLogger(WebhookRouter.class);

    private final WebhookHandlerRegistry registry;
    private final TokenService tokenService;
    private final LoopGuard loopGuard;
    private final TaskLifecycleService lifecycle;
    private final TaskPublisher publisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public WebhookRouter(WebhookHandlerRegistry registry, TokenService tokenService, LoopGuard loopGuard,
                         TaskLifecycleService lifecycle, TaskPublisher publisher,
                         MeterRegistry meterRegistry, Clock clock) {
        this.registry = registry;
        this.tokenService = tokenService;
        this.loopGuard = loopGuard;
        this.lifecycle = lifecycle;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public WebhookOutcome route(String provider, byte[] rawBody, Map<String, String> headers) {
        WebhookHandler handler = registry.getHandler(provider).orElse(null);
        if (handler == null) {
            count("unknown", "unknown-provider");
            throw new UnknownProviderException(provider);
        }
        MDC.put("provider", handler.provider());
        try {
            WebhookOutcome outcome = process(handler, rawBody, headers);
            count(handler.provider(), outcome.skipped() ? "skipped" : "queued");
            return outcome;
        } catch (RuntimeException e) {
            count(handler.provider(), "rejected");
            throw e;
        } finally {
            MDC.remove("provider");
            MDC.remove("taskId");
        }
    }

    private WebhookOutcome process(WebhookHandler handler, byte[] rawBody, Map<String, String> headers) {
        WebhookEvent event = handler.parse(rawBody, headers);
        log.debug("Parsed {} event {} for org {}", handler.provider(), event.eventType(), event.organizationId());

        String secret = tokenService.getWebhookSecret(handler.provider(), event.organizationId());
        if (!handler.validate(rawBody, headers, secret))
            throw new SignatureValidationException(handler.provider());

        if (loopGuard.isSelfPosted(event.externalId())) {
            log.info("Skipping {} event {}: {} was posted by us", handler.provider(), event.eventType(),
                    event.externalId());
            return WebhookOutcome.skipped(WebhookOutcome.SELF_POSTED);
        }
        if (!handler.shouldProcess(event)) {
            log.info("Skipping {} event {}: no trigger", handler.provider(), event.eventType());
            return WebhookOutcome.skipped(WebhookOutcome.NO_TRIGGER);
        }

        TaskRequest request = handler.buildTaskRequest(event);
        TaskMessage message = TaskMessage.from(event, request, clock.instant());
        MDC.put("taskId", message.taskId());
        lifecycle.accept(message);
        try {
            publisher.publish(message);
        } catch (QueueUnavailableException e) {
            lifecycle.discard(message.taskId());
            throw e;
        }
        log.info("Queued task {} for {} event {} (org {})", message.taskId(), handler.provider(),
                event.eventType(), event.organizationId());
        return WebhookOutcome.queued(message.taskId());
    }

    private void count(String provider, String outcome) {
        Counter.builder("taskgate.webhooks.received")
                .description("Webhook deliveries by provider and outcome")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
