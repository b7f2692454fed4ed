package tech.syncbridge.platform.ledger;

public enum LedgerKind {
    SYNC_JOB,
    WEBHOOK_EVENT
}
