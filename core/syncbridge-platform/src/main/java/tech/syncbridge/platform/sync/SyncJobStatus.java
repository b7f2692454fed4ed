package tech.syncbridge.platform.sync;

public enum SyncJobStatus {
    QUEUED,
    RUNNING,
    /** Paused by a provider rate limit; resumes at next_attempt_at. */
    THROTTLED,
    SUCCEEDED,
    FAILED,
    PARTIALLY_FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == PARTIALLY_FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return !isTerminal();
    }
}
