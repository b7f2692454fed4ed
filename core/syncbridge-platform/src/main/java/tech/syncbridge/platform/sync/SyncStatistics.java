package tech.syncbridge.platform.sync;

import java.util.Map;

/**
 * Per-instance job counts by status and record totals across jobs on file.
 */
public record SyncStatistics(String instanceId, Map<SyncJobStatus, Long> jobsByStatus, SyncStats records) {
}
