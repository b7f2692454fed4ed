package tech.syncbridge.platform.webhook;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.syncbridge.platform.ledger.JobLedger;
import tech.syncbridge.platform.ledger.LedgerKind;
import tech.syncbridge.platform.metrics.SyncMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Moves a webhook event through PROCESSING to PROCESSED, or to FAILED with a persisted retry
 * time, and finally to DEAD_LETTERED once retries are exhausted.
 */
@ApplicationScoped
public class WebhookProcessor {

    private static final Logger LOG = Logger.getLogger(WebhookProcessor.class);

    private final WebhookEventRepository events;
    private final WebhookHandlers handlers;
    private final JobLedger ledger;
    private final SyncMetrics metrics;
    private final WebhookConfig config;

    @Inject
    public WebhookProcessor(WebhookEventRepository events, WebhookHandlers handlers, JobLedger ledger,
                            SyncMetrics metrics, WebhookConfig config) {
        this.events = events;
        this.handlers = handlers;
        this.ledger = ledger;
        this.metrics = metrics;
        this.config = config;
    }

    /**
     * Process one event if it is waiting and due. Returns the status it ended in.
     */
    public WebhookStatus process(String eventId) {
        WebhookEvent event = events.findById(eventId).orElse(null);
        if (event == null) {
            LOG.warnf("Webhook event [%s] not found", eventId);
            return null;
        }
        Instant now = Instant.now();
        boolean waiting = event.status == WebhookStatus.RECEIVED
            || (event.status == WebhookStatus.FAILED && event.isDue(now));
        if (!waiting) {
            LOG.debugf("Webhook event [%s] is %s, nothing to process", eventId, event.status);
            return event.status;
        }

        MDC.put("webhookEventId", event.id);
        MDC.put("instanceId", event.instanceId);
        try {
            event.status = WebhookStatus.PROCESSING;
            event.updatedAt = now;
            events.update(event);
            ledger.recordStart(event.id, LedgerKind.WEBHOOK_EVENT);

            String key = idempotencyKey(event);
            if (ledger.isAlreadyProcessed(key)) {
                LOG.debugf("Webhook event [%s] effects already committed", event.id);
            } else {
                handlers.dispatch(event);
                ledger.markProcessed(key, event.id);
            }
            markProcessed(event);
        } catch (RuntimeException e) {
            markFailed(event, e);
        } finally {
            MDC.remove("instanceId");
            MDC.remove("webhookEventId");
        }
        return event.status;
    }

    private void markProcessed(WebhookEvent event) {
        Instant now = Instant.now();
        event.status = WebhookStatus.PROCESSED;
        event.nextAttemptAt = null;
        event.lastError = null;
        event.processedAt = now;
        event.updatedAt = now;
        events.update(event);
        ledger.recordTerminal(event.id, WebhookStatus.PROCESSED.name(), Map.of("retries", event.retryCount));
        LOG.debugf("Webhook event [%s] processed", event.id);
    }

    private void markFailed(WebhookEvent event, RuntimeException e) {
        Instant now = Instant.now();
        Duration delay = backoff(event.retryCount);
        event.retryCount++;
        event.lastError = e.getMessage();
        event.updatedAt = now;

        if (event.retryCount > config.maxRetries()) {
            event.status = WebhookStatus.DEAD_LETTERED;
            event.nextAttemptAt = null;
            events.update(event);
            ledger.recordTerminal(event.id, WebhookStatus.DEAD_LETTERED.name(), Map.of("retries", event.retryCount));
            metrics.webhookDeadLettered(event.provider.getValue());
            LOG.errorf(e, "ALERT: webhook event [%s] from %s for instance [%s] dead-lettered after %d attempts",
                event.id, event.provider.getValue(), event.instanceId, event.retryCount);
            return;
        }

        event.status = WebhookStatus.FAILED;
        event.nextAttemptAt = now.plus(delay);
        events.update(event);
        LOG.warnf("Webhook event [%s] failed (attempt %d), retrying at %s: %s",
            event.id, event.retryCount, event.nextAttemptAt, e.getMessage());
    }

    /**
     * min(2^retryCount * base, max)
     */
    Duration backoff(int retryCount) {
        long factor = 1L << Math.min(retryCount, 20);
        Duration delay = config.retryBaseDelay().multipliedBy(factor);
        return delay.compareTo(config.retryMaxDelay()) > 0 ? config.retryMaxDelay() : delay;
    }

    /**
     * Keyed on the payload hash, like the dedupe index.
     */
    static String idempotencyKey(WebhookEvent event) {
        return "whk:" + event.instanceId + ":" + event.payloadHash;
    }
}
