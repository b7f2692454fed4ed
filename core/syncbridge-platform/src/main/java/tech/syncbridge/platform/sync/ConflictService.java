package tech.syncbridge.platform.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.localstore.LocalRecordRepository;
import tech.syncbridge.platform.store.SyncStore;

import java.time.Instant;
import java.util.List;

/**
 * Listing and manual resolution of sync conflicts.
 */
@ApplicationScoped
public class ConflictService {

    private static final Logger LOG = Logger.getLogger(ConflictService.class);

    private final SyncStore store;
    private final ConflictRepository conflicts;
    private final LocalRecordRepository localRecords;

    @Inject
    public ConflictService(SyncStore store, ConflictRepository conflicts, LocalRecordRepository localRecords) {
        this.store = store;
        this.conflicts = conflicts;
        this.localRecords = localRecords;
    }

    public List<ConflictRecord> list(String instanceId, boolean openOnly) {
        return conflicts.findByInstance(instanceId, openOnly);
    }

    public ConflictRecord get(String id) {
        return conflicts.findById(id).orElseThrow(() -> new NotFoundException("Conflict not found: " + id));
    }

    /**
     * Settle an open conflict. SOURCE_WINS keeps the provider version locally; TARGET_WINS and
     * MERGE mark the local version dirty so the next push sends it to the provider.
     *
     * @throws IllegalArgumentException if the resolution is MANUAL_REQUIRED
     * @throws IllegalStateException if the conflict is not open
     */
    public ConflictRecord resolve(String id, ConflictResolution resolution, String actor) {
        if (resolution == ConflictResolution.MANUAL_REQUIRED) {
            throw new IllegalArgumentException("A conflict must be resolved as SOURCE_WINS, TARGET_WINS or MERGE");
        }

        return store.inTransaction(conn -> {
            ConflictRecord conflict = get(id);
            if (!conflict.isOpen()) {
                throw new IllegalStateException("Conflict " + id + " is already resolved as " + conflict.resolution);
            }

            Instant now = Instant.now();
            switch (resolution) {
                case SOURCE_WINS -> localRecords.applyRemote(conflict.instanceId, conflict.entityType,
                    conflict.entityId, conflict.sourceData, conflict.sourceVersion);
                case TARGET_WINS -> localRecords.saveLocalChange(conflict.instanceId, conflict.entityType,
                    conflict.entityId, conflict.targetData, now);
                case MERGE -> localRecords.saveLocalChange(conflict.instanceId, conflict.entityType,
                    conflict.entityId, ConflictResolver.merge(conflict.sourceData, conflict.targetData), now);
                default -> throw new IllegalArgumentException("Unsupported resolution " + resolution);
            }

            conflict.resolution = resolution;
            conflict.resolvedBy = actor;
            conflict.resolvedAt = now;
            conflicts.update(conflict);
            LOG.infof("Conflict [%s] on %s/%s resolved as %s by [%s]",
                id, conflict.entityType, conflict.entityId, resolution, actor);
            return conflict;
        });
    }
}
