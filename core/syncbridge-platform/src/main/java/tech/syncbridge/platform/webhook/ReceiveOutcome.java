package tech.syncbridge.platform.webhook;

/**
 * Result of receiving a webhook.
 */
public sealed interface ReceiveOutcome permits ReceiveOutcome.Accepted, ReceiveOutcome.Rejected {

    /**
     * Event persisted. {@code status} is RECEIVED when queued for processing, DEDUPED for a redelivery.
     */
    record Accepted(String eventId, WebhookStatus status) implements ReceiveOutcome {
        public boolean isDeduped() {
            return status == WebhookStatus.DEDUPED;
        }
    }

    /**
     * Event refused and not persisted.
     */
    record Rejected(RejectionReason reason, String message) implements ReceiveOutcome {
    }
}
