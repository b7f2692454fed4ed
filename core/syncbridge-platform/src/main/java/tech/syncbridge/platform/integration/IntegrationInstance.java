package tech.syncbridge.platform.integration;

import tech.syncbridge.platform.sync.ConflictPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * One tenant's connection to one external platform account.
 */
public class IntegrationInstance {

    public String id;
    public String tenantId;
    public String name;
    public ProviderType providerType;
    public IntegrationStatus status;

    /**
     * Id of the credential version currently in use, null until connected.
     */
    public String credentialRef;

    public ConflictPolicy conflictPolicy;

    /**
     * Optional recurring sync. Null when the instance only syncs on demand.
     */
    public SyncSchedule schedule;
    public Instant lastScheduledAt;

    // Statistics
    public int totalSyncs;
    public int successfulSyncs;
    public int failedSyncs;
    public int consecutiveAuthFailures;
    public Instant lastSyncAt;
    public String lastError;

    public Instant createdAt;
    public Instant updatedAt;

    public IntegrationInstance() {
    }

    public boolean isScheduleDue(Instant now) {
        if (schedule == null || !status.canSync()) {
            return false;
        }
        return lastScheduledAt == null
            || !lastScheduledAt.plus(Duration.ofMinutes(schedule.intervalMinutes())).isAfter(now);
    }
}
