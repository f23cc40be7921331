package dev.taskgate.webhook;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebhookHandlerRegistryTest {

    @Test
    void registersDiscoveredHandlersAndListsSorted() {
        WebhookHandler slack = handler("slack");
        WebhookHandler github = handler("github");

        WebhookHandlerRegistry registry = new WebhookHandlerRegistry(List.of(slack, github));

        assertThat(registry.listProviders()).containsExactly("github", "slack");
        assertThat(registry.getHandler("GitHub")).containsSame(github);
    }

    @Test
    void lastRegistrationWins() {
        WebhookHandler first = handler("jira");
        WebhookHandler second = handler("jira");
        WebhookHandlerRegistry registry = new WebhookHandlerRegistry(List.of(first));

        registry.register("jira", second);

        assertThat(registry.getHandler("jira")).containsSame(second);
        assertThat(registry.listProviders()).containsExactly("jira");
    }

    @Test
    void unregisterRemovesProvider() {
        WebhookHandlerRegistry registry = new WebhookHandlerRegistry(List.of(handler("sentry")));

        registry.unregister("sentry");

        assertThat(registry.getHandler("sentry")).isEmpty();
        assertThat(registry.listProviders()).isEmpty();
    }

    @Test
    void unknownOrNullProviderIsEmpty() {
        WebhookHandlerRegistry registry = new WebhookHandlerRegistry(List.of());
        assertThat(registry.getHandler("bitbucket")).isEmpty();
        assertThat(registry.getHandler(null)).isEmpty();
    }

    private static WebhookHandler handler(String provider) {
        WebhookHandler handler = mock(WebhookHandler.class);
        when(handler.provider()).thenReturn(provider);
        return handler;
    }
}
