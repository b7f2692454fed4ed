package tech.syncbridge.platform.webhook;

public enum WebhookStatus {
    RECEIVED,
    PROCESSING,
    PROCESSED,
    /** Failed at least once; retried at next_attempt_at. */
    FAILED,
    /** Same payload already seen inside the dedupe window. */
    DEDUPED,
    DEAD_LETTERED;

    public boolean isTerminal() {
        return this == PROCESSED || this == DEDUPED || this == DEAD_LETTERED;
    }
}
