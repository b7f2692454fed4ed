package tech.syncbridge.platform.sync;

import java.util.List;
import java.util.Optional;

public interface ConflictRepository {

    void insert(ConflictRecord conflict);

    void update(ConflictRecord conflict);

    Optional<ConflictRecord> findById(String id);

    List<ConflictRecord> findByInstance(String instanceId, boolean openOnly);

    boolean hasOpenConflict(String instanceId, String entityType, String entityId);
}
