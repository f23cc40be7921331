package dev.taskgate.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps provider names to handlers. Handler beans are auto-registered via
 * {@code List<WebhookHandler>} injection; registering an existing provider replaces
 * the previous handler (last write wins).
 */
@Component
public class WebhookHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(WebhookHandlerRegistry.class);

    private final Map<String, WebhookHandler> handlers = new ConcurrentHashMap<>();

    public WebhookHandlerRegistry(List<WebhookHandler> discovered) {
        discovered.forEach(h -> register(h.provider(), h));
    }

    public void register(String provider, WebhookHandler handler) {
        WebhookHandler previous = handlers.put(normalize(provider), handler);
        if (previous != null && previous != handler) {
            log.info("Replaced webhook handler for provider {}: {} -> {}", provider,
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            log.info("Registered webhook handler for provider {}", provider);
        }
    }

    public void unregister(String provider) {
        if (handlers.remove(normalize(provider)) != null)
            log.info("Unregistered webhook handler for provider {}", provider);
    }

    public Optional<WebhookHandler> getHandler(String provider) {
        if (provider == null) return Optional.empty();
        return Optional.ofNullable(handlers.get(normalize(provider)));
    }

    public List<String> listProviders() {
        return handlers.keySet().stream().sorted().toList();
    }

    private static String normalize(String provider) {
        return provider.trim().toLowerCase(Locale.ROOT);
    }
}
