package tech.syncbridge.platform.webhook;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

@ApplicationScoped
public class WebhookProviderProducer {

    @Produces
    @Singleton
    WebhookProviders webhookProviders() {
        return WebhookProviders.defaults();
    }
}
