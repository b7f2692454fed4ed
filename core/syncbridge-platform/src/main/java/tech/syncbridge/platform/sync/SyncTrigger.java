package tech.syncbridge.platform.sync;

public enum SyncTrigger {
    MANUAL,
    SCHEDULED,
    WEBHOOK
}
