package dev.taskgate.controller;

import dev.taskgate.queue.TaskQueue;
import dev.taskgate.webhook.WebhookHandlerRegistry;
import dev.taskgate.webhook.WebhookOutcome;
import dev.taskgate.webhook.WebhookRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Webhook receiver for every registered provider. The body is taken as raw bytes so the
 * signature can be checked against exactly what the provider signed. Returns within the
 * request: all task work happens on the worker pool.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookRouter router;
    private final WebhookHandlerRegistry registry;
    private final TaskQueue queue;

    public WebhookController(WebhookRouter router, WebhookHandlerRegistry registry, TaskQueue queue) {
        this.router = router;
        this.registry = registry;
        this.queue = queue;
    }

    @PostMapping("/{provider}")
    public ResponseEntity<WebhookOutcome> receive(@PathVariable String provider,
                                                  @RequestHeader Map<String, String> headers,
                                                  @RequestBody(required = false) byte[] body) {
        log.debug("Webhook delivery for provider={} ({} bytes)", provider, body == null ? 0 : body.length);
        return ResponseEntity.ok(router.route(provider, body == null ? new byte[0] : body, lowerCase(headers)));
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("providers", registry.listProviders());
        body.put("queue_depth", queue.length());
        return body;
    }

    private static Map<String, String> lowerCase(Map<String, String> headers) {
        Map<String, String> normalized = new HashMap<>();
        headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
        return normalized;
    }
}
