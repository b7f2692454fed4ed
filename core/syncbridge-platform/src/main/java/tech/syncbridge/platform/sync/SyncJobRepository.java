package tech.syncbridge.platform.sync;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface SyncJobRepository {

    /**
     * Insert a job. A job whose trigger ref is already taken is not inserted.
     *
     * @return false when another job owns the same trigger ref
     */
    boolean insert(SyncJob job);

    void update(SyncJob job);

    Optional<SyncJob> findById(String id);

    Optional<SyncJob> findByTriggerRef(String triggerRef);

    List<SyncJob> findByInstance(String instanceId, int limit);

    /**
     * Non-terminal jobs of an instance, oldest first.
     */
    List<SyncJob> findActiveByInstance(String instanceId);

    /**
     * Non-terminal jobs across all instances, oldest first.
     */
    List<SyncJob> findActive(int limit);

    List<SyncJob> findByStatus(SyncJobStatus status);

    /**
     * Set the cancel flag without touching the rest of the row, which the running worker owns.
     */
    void requestCancel(String id);

    boolean isCancelRequested(String id);

    Map<SyncJobStatus, Long> countByStatus(String instanceId);

    /**
     * Record counters summed over every job of an instance still on file.
     */
    SyncStats sumStats(String instanceId);
}
