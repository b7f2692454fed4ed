package tech.syncbridge.platform.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.IntegrationService;
import tech.syncbridge.platform.integration.IntegrationStatus;
import tech.syncbridge.platform.mapping.FieldMappingService;
import tech.syncbridge.platform.mapping.MappingDirection;
import tech.syncbridge.platform.shared.EntityType;
import tech.syncbridge.platform.shared.TsidGenerator;
import tech.syncbridge.platform.store.SyncStore;
import tech.syncbridge.platform.worker.SyncWorkerPool;
import tech.syncbridge.platform.worker.WorkItem;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Creates, cancels and dispatches sync jobs.
 *
 * <p>Jobs are durable rows first and work items second: the pool is only told about the head
 * job of an instance, and pollers re-offer anything the pool lost (restart, throttling).</p>
 */
@ApplicationScoped
public class SyncJobService {

    private static final Logger LOG = Logger.getLogger(SyncJobService.class);

    private final SyncStore store;
    private final SyncJobRepository jobs;
    private final IntegrationService integrations;
    private final FieldMappingService mappings;
    private final SyncWorkerPool pool;

    @Inject
    public SyncJobService(SyncStore store, SyncJobRepository jobs, IntegrationService integrations,
                          FieldMappingService mappings, SyncWorkerPool pool) {
        this.store = store;
        this.jobs = jobs;
        this.integrations = integrations;
        this.mappings = mappings;
        this.pool = pool;
    }

    public SyncJob trigger(String instanceId, Set<String> entityTypes, SyncDirection direction) {
        return trigger(instanceId, entityTypes, direction, SyncTrigger.MANUAL, null, null);
    }

    /**
     * Queue a job. A job whose trigger ref already exists is not created again; the existing one is returned.
     *
     * @throws NotFoundException if the instance does not exist
     * @throws IllegalStateException if the instance is not ACTIVE
     * @throws BadRequestException if no entity types are given or a needed mapping is missing
     */
    public SyncJob trigger(String instanceId, Set<String> entityTypes, SyncDirection direction,
                           SyncTrigger trigger, String triggerRef, List<String> targetExternalIds) {
        IntegrationInstance instance = integrations.get(instanceId);
        if (instance.status != IntegrationStatus.ACTIVE) {
            throw new IllegalStateException("Integration instance " + instanceId + " is " + instance.status
                + ", reconnect it before syncing");
        }
        if (entityTypes == null || entityTypes.isEmpty()) {
            throw new BadRequestException("At least one entity type is required");
        }
        boolean targeted = targetExternalIds != null && !targetExternalIds.isEmpty();
        for (String entityType : entityTypes) {
            if (direction.pulls()) {
                requireMapping(instanceId, entityType, MappingDirection.INBOUND);
            }
            if (direction.pushes() && !targeted) {
                requireMapping(instanceId, entityType, MappingDirection.OUTBOUND);
            }
        }

        Instant now = Instant.now();
        SyncJob job = new SyncJob();
        job.id = TsidGenerator.generate(EntityType.SYNC_JOB);
        job.instanceId = instanceId;
        job.entityTypes = new LinkedHashSet<>(entityTypes);
        job.direction = direction;
        job.status = SyncJobStatus.QUEUED;
        job.trigger = trigger;
        job.triggerRef = triggerRef;
        job.targetExternalIds = targeted ? List.copyOf(targetExternalIds) : null;
        job.createdAt = now;
        job.updatedAt = now;

        if (!jobs.insert(job)) {
            SyncJob existing = jobs.findByTriggerRef(triggerRef)
                .orElseThrow(() -> new IllegalStateException("Job for trigger " + triggerRef + " vanished"));
            LOG.infof("Trigger [%s] already produced job [%s]", triggerRef, existing.id);
            return existing;
        }
        LOG.infof("Sync job [%s] queued for instance [%s]: %s %s (%s)",
            job.id, instanceId, direction.getValue(), job.entityTypes, trigger);
        dispatchNext(instanceId);
        return job;
    }

    /**
     * Queue a PULL of specific records, keyed by the event that reported them.
     */
    public SyncJob enqueueTargeted(String instanceId, String entityType, List<String> externalIds, String triggerRef) {
        return trigger(instanceId, Set.of(entityType), SyncDirection.PULL, SyncTrigger.WEBHOOK, triggerRef, externalIds);
    }

    public SyncJob get(String id) {
        return jobs.findById(id).orElseThrow(() -> new NotFoundException("Sync job not found: " + id));
    }

    public List<SyncJob> list(String instanceId, int limit) {
        return jobs.findByInstance(instanceId, limit);
    }

    public boolean hasActiveJob(String instanceId) {
        return !jobs.findActiveByInstance(instanceId).isEmpty();
    }

    /**
     * Cancel a job. Waiting jobs stop immediately; a running job stops at its next page boundary
     * and keeps what it already committed.
     *
     * @throws IllegalStateException if the job already finished
     */
    public SyncJob cancel(String id) {
        SyncJob job = store.inTransaction(conn -> {
            SyncJob current = get(id);
            if (current.status.isTerminal()) {
                throw new IllegalStateException("Sync job " + id + " already finished as " + current.status);
            }
            jobs.requestCancel(id);
            current.cancelRequested = true;
            if (current.status != SyncJobStatus.RUNNING) {
                Instant now = Instant.now();
                current.status = SyncJobStatus.CANCELLED;
                current.nextAttemptAt = null;
                current.completedAt = now;
                current.updatedAt = now;
                jobs.update(current);
            }
            return current;
        });
        if (job.status == SyncJobStatus.CANCELLED) {
            LOG.infof("Sync job [%s] cancelled before running", id);
            dispatchNext(job.instanceId);
        } else {
            LOG.infof("Cancellation requested for running sync job [%s]", id);
        }
        return job;
    }

    public SyncStatistics statistics(String instanceId) {
        integrations.get(instanceId);
        return new SyncStatistics(instanceId, jobs.countByStatus(instanceId), jobs.sumStats(instanceId));
    }

    /**
     * Offer the instance's oldest active job to the pool if it is due and not running.
     *
     * @return true if a work item was submitted
     */
    public boolean dispatchNext(String instanceId) {
        Optional<SyncJob> head = jobs.findActiveByInstance(instanceId).stream().findFirst();
        if (head.isEmpty()) {
            return false;
        }
        SyncJob job = head.get();
        if (job.status == SyncJobStatus.RUNNING || !job.isDue(Instant.now())) {
            return false;
        }
        return pool.submit(new WorkItem.SyncJobWork(job.id, job.instanceId));
    }

    private void requireMapping(String instanceId, String entityType, MappingDirection direction) {
        if (mappings.activeFor(instanceId, entityType, direction).isEmpty()) {
            throw new BadRequestException("No active " + direction + " field mapping for entity type " + entityType);
        }
    }
}
