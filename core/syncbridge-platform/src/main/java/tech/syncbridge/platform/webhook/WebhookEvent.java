package tech.syncbridge.platform.webhook;

import tech.syncbridge.platform.integration.ProviderType;

import java.time.Instant;
import java.util.List;

/**
 * One inbound notification from an external platform.
 */
public class WebhookEvent {

    public String id;
    public String instanceId;
    public ProviderType provider;
    public String eventType;

    /**
     * Entity type the event reports changes for, null when the payload names none.
     */
    public String entityType;

    /**
     * External ids of the changed records.
     */
    public List<String> entityRefs;

    public String payload;

    /**
     * SHA-256 of the raw body, hex encoded. Used for deduplication.
     */
    public String payloadHash;

    public boolean signatureValid;
    public WebhookStatus status;
    public int retryCount;
    public Instant nextAttemptAt;
    public String lastError;
    public Instant receivedAt;
    public Instant processedAt;
    public Instant updatedAt;

    public WebhookEvent() {
    }

    public boolean isDue(Instant now) {
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }
}
