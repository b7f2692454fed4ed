package tech.syncbridge.platform.sync;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One execution of data synchronization for an integration instance.
 *
 * <p>Created by {@link SyncJobService}; mutated only by the worker running it.
 * The cursor is persisted at every checkpoint so a re-run resumes instead of restarting.</p>
 */
public class SyncJob {

    public String id;
    public String instanceId;
    public Set<String> entityTypes;
    public SyncDirection direction;
    public SyncJobStatus status;
    public SyncTrigger trigger;

    /**
     * Unique origin of the job (e.g. the webhook event id), null for manual runs.
     */
    public String triggerRef;

    /**
     * When set, the job pulls exactly these records instead of paginating changes.
     */
    public List<String> targetExternalIds;

    public JobCursor cursor = new JobCursor();
    public SyncStats stats = new SyncStats();

    /**
     * Mapping version used, keyed by mapping id. Pinned on the first run and locked when the job completes.
     */
    public Map<String, Integer> mappingVersions;

    public List<RecordError> recordErrors = new ArrayList<>();
    public JobFailure failure;

    /**
     * Id of the credential version pinned when the run started.
     */
    public String credentialRef;

    public int attempt;
    public Instant nextAttemptAt;
    public boolean cancelRequested;

    public Instant createdAt;
    public Instant startedAt;
    public Instant completedAt;
    public Instant updatedAt;

    public SyncJob() {
    }

    public boolean isTargeted() {
        return targetExternalIds != null && !targetExternalIds.isEmpty();
    }

    public boolean isDue(Instant now) {
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }
}
