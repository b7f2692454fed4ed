package tech.syncbridge.platform.ledger;

public record RetentionResult(int ledgerEntries, int idempotencyKeys, int syncJobs, int webhookEvents) {

    public int total() {
        return ledgerEntries + idempotencyKeys + syncJobs + webhookEvents;
    }
}
