package tech.syncbridge.platform.localstore;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface LocalRecordRepository {

    Optional<LocalRecord> find(String instanceId, String entityType, String externalId);

    /**
     * Write a local change. The record becomes dirty and will be pushed.
     */
    LocalRecord saveLocalChange(String instanceId, String entityType, String externalId,
                                Map<String, Object> data, Instant modifiedAt);

    /**
     * Write a record received from the provider. Clears the dirty flag.
     */
    LocalRecord applyRemote(String instanceId, String entityType, String externalId,
                            Map<String, Object> data, Instant remoteModifiedAt);

    /**
     * Dirty records with a change sequence above {@code afterSeq}, lowest first.
     */
    List<LocalRecord> findDirty(String instanceId, String entityType, long afterSeq, int limit);

    /**
     * Clear the dirty flag after a push, unless the record changed again since {@code pushedSeq}.
     */
    void markSynced(String instanceId, String entityType, String externalId, long pushedSeq, Instant remoteModifiedAt);
}
