package tech.syncbridge.platform.integration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.credential.Credential;
import tech.syncbridge.platform.credential.CredentialRef;
import tech.syncbridge.platform.credential.CredentialStore;
import tech.syncbridge.platform.shared.EntityType;
import tech.syncbridge.platform.shared.TsidGenerator;
import tech.syncbridge.platform.store.SyncStore;
import tech.syncbridge.platform.sync.ConflictPolicy;
import tech.syncbridge.platform.sync.SyncConfig;
import tech.syncbridge.platform.sync.SyncJobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Lifecycle and statistics of integration instances.
 */
@ApplicationScoped
public class IntegrationService {

    private static final Logger LOG = Logger.getLogger(IntegrationService.class);

    private final SyncStore store;
    private final IntegrationInstanceRepository repository;
    private final CredentialStore credentialStore;
    private final SyncConfig syncConfig;

    @Inject
    public IntegrationService(SyncStore store, IntegrationInstanceRepository repository,
                              CredentialStore credentialStore, SyncConfig syncConfig) {
        this.store = store;
        this.repository = repository;
        this.credentialStore = credentialStore;
        this.syncConfig = syncConfig;
    }

    public IntegrationInstance create(String tenantId, String name, ProviderType providerType,
                                      ConflictPolicy conflictPolicy, SyncSchedule schedule) {
        Instant now = Instant.now();
        IntegrationInstance instance = new IntegrationInstance();
        instance.id = TsidGenerator.generate(EntityType.INTEGRATION_INSTANCE);
        instance.tenantId = tenantId;
        instance.name = name;
        instance.providerType = providerType;
        instance.status = IntegrationStatus.PENDING_AUTH;
        instance.conflictPolicy = conflictPolicy;
        instance.schedule = schedule;
        instance.createdAt = now;
        instance.updatedAt = now;
        repository.insert(instance);
        LOG.infof("Integration instance [%s] created for tenant [%s] provider [%s]",
            instance.id, tenantId, providerType.getValue());
        return instance;
    }

    public Optional<IntegrationInstance> find(String id) {
        return repository.findById(id);
    }

    public IntegrationInstance get(String id) {
        return repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Integration instance not found: " + id));
    }

    public List<IntegrationInstance> list(String tenantId) {
        return repository.findByTenant(tenantId);
    }

    /**
     * Store (or rotate) the instance credential and activate it. Reactivates an
     * instance in ERROR, which is how a user reauthorizes.
     *
     * @throws IllegalStateException if the instance was disconnected
     */
    public IntegrationInstance connect(String id, Credential credential, String actor) {
        IntegrationInstance existing = get(id);
        if (existing.status == IntegrationStatus.REVOKED) {
            throw new IllegalStateException("Integration instance " + id + " was disconnected");
        }

        CredentialRef ref = existing.credentialRef == null
            ? credentialStore.store(id, credential, actor)
            : credentialStore.rotate(id, credential, actor);

        IntegrationInstance updated = mutate(id, instance -> {
            instance.credentialRef = ref.id();
            instance.status = IntegrationStatus.ACTIVE;
            instance.consecutiveAuthFailures = 0;
            instance.lastError = null;
        });
        LOG.infof("Integration instance [%s] connected with credential version %d", id, ref.version());
        return updated;
    }

    /**
     * Count an authentication failure. Remote revocation moves straight to REVOKED,
     * otherwise the instance moves to ERROR once the configured threshold is reached.
     */
    public IntegrationInstance recordAuthFailure(String id, String message, boolean revoked) {
        IntegrationInstance updated = mutate(id, instance -> {
            instance.consecutiveAuthFailures++;
            instance.lastError = message;
            if (revoked) {
                instance.status = IntegrationStatus.REVOKED;
            } else if (instance.consecutiveAuthFailures >= syncConfig.authFailureThreshold()
                    && instance.status != IntegrationStatus.REVOKED) {
                instance.status = IntegrationStatus.ERROR;
            }
        });
        LOG.warnf("Integration instance [%s] authentication failure #%d, status now %s: %s",
            id, updated.consecutiveAuthFailures, updated.status, message);
        return updated;
    }

    public void recordSyncOutcome(String id, SyncJobStatus status, String error) {
        mutate(id, instance -> {
            instance.totalSyncs++;
            instance.lastSyncAt = Instant.now();
            if (status == SyncJobStatus.SUCCEEDED) {
                instance.successfulSyncs++;
                instance.lastError = null;
            } else if (status == SyncJobStatus.FAILED || status == SyncJobStatus.PARTIALLY_FAILED) {
                instance.failedSyncs++;
                instance.lastError = error;
            }
            if (status != SyncJobStatus.FAILED) {
                instance.consecutiveAuthFailures = 0;
            }
        });
    }

    public void markScheduled(String id, Instant at) {
        mutate(id, instance -> instance.lastScheduledAt = at);
    }

    /**
     * Disconnect: the instance becomes REVOKED and every credential version is purged.
     */
    public IntegrationInstance disconnect(String id, String actor) {
        IntegrationInstance updated = mutate(id, instance -> {
            instance.status = IntegrationStatus.REVOKED;
            instance.credentialRef = null;
        });
        credentialStore.purgeAll(id, actor);
        LOG.infof("Integration instance [%s] disconnected by [%s]", id, actor);
        return updated;
    }

    public ConflictPolicy conflictPolicyFor(IntegrationInstance instance) {
        return instance.conflictPolicy != null ? instance.conflictPolicy : syncConfig.defaultConflictPolicy();
    }

    public List<IntegrationInstance> findScheduled() {
        return repository.findScheduled();
    }

    private IntegrationInstance mutate(String id, Consumer<IntegrationInstance> change) {
        return store.inTransaction(conn -> {
            IntegrationInstance instance = get(id);
            change.accept(instance);
            instance.updatedAt = Instant.now();
            repository.update(instance);
            return instance;
        });
    }
}
