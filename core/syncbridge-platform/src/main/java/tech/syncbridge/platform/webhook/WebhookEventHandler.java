package tech.syncbridge.platform.webhook;

/**
 * Reacts to a processed webhook event. Throwing fails the event, which is then retried.
 */
@FunctionalInterface
public interface WebhookEventHandler {

    void handle(WebhookEvent event);
}
