package tech.syncbridge.platform.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.syncbridge.platform.credential.Credential;
import tech.syncbridge.platform.credential.CredentialExpiredException;
import tech.syncbridge.platform.credential.CredentialNotFoundException;
import tech.syncbridge.platform.credential.CredentialRef;
import tech.syncbridge.platform.credential.CredentialStore;
import tech.syncbridge.platform.credential.EncryptionException;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.IntegrationService;
import tech.syncbridge.platform.integration.IntegrationStatus;
import tech.syncbridge.platform.ledger.JobLedger;
import tech.syncbridge.platform.ledger.LedgerKind;
import tech.syncbridge.platform.localstore.LocalRecord;
import tech.syncbridge.platform.localstore.LocalRecordRepository;
import tech.syncbridge.platform.mapping.FieldMappingService;
import tech.syncbridge.platform.mapping.FieldMappingVersion;
import tech.syncbridge.platform.mapping.MappingDirection;
import tech.syncbridge.platform.metrics.SyncMetrics;
import tech.syncbridge.platform.provider.ExternalRecord;
import tech.syncbridge.platform.provider.MalformedRecord;
import tech.syncbridge.platform.provider.ProviderAuthException;
import tech.syncbridge.platform.provider.ProviderClient;
import tech.syncbridge.platform.provider.ProviderContext;
import tech.syncbridge.platform.provider.ProviderRecordException;
import tech.syncbridge.platform.provider.ProviderRegistry;
import tech.syncbridge.platform.provider.ProviderUnavailableException;
import tech.syncbridge.platform.provider.RateLimitedException;
import tech.syncbridge.platform.provider.RecordPage;
import tech.syncbridge.platform.provider.UnsupportedProviderException;
import tech.syncbridge.platform.provider.WriteResult;
import tech.syncbridge.platform.shared.EntityType;
import tech.syncbridge.platform.shared.TsidGenerator;
import tech.syncbridge.platform.store.JsonColumns;
import tech.syncbridge.platform.store.SyncStore;
import tech.syncbridge.transform.TransformResult;
import tech.syncbridge.transform.TransformationEngine;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Executes a sync job end to end: fetch changes, resolve conflicts, transform, write, checkpoint.
 *
 * <p>Progress is checkpointed after every committed page (job cursor, watermark and ledger in one
 * transaction), and every record write is paired with its idempotency key, so a run interrupted at
 * any point resumes without re-writing committed records or skipping uncommitted ones.</p>
 *
 * <p>Only the oldest active job of an instance runs; later jobs wait until it is terminal.
 * Transient failures reschedule the job through {@code next_attempt_at} rather than retrying in memory.</p>
 */
@ApplicationScoped
public class SyncOrchestrator {

    private static final Logger LOG = Logger.getLogger(SyncOrchestrator.class);

    private final SyncStore store;
    private final SyncJobRepository jobs;
    private final IntegrationService integrations;
    private final CredentialStore credentials;
    private final FieldMappingService mappings;
    private final TransformationEngine engine;
    private final ProviderRegistry providers;
    private final WatermarkRepository watermarks;
    private final LocalRecordRepository localRecords;
    private final ConflictRepository conflicts;
    private final JobLedger ledger;
    private final SyncMetrics metrics;
    private final SyncConfig config;
    private final JsonColumns json;
    private final ObjectWriter canonicalWriter;

    @Inject
    public SyncOrchestrator(SyncStore store, SyncJobRepository jobs, IntegrationService integrations,
                            CredentialStore credentials, FieldMappingService mappings, TransformationEngine engine,
                            ProviderRegistry providers, WatermarkRepository watermarks,
                            LocalRecordRepository localRecords, ConflictRepository conflicts, JobLedger ledger,
                            SyncMetrics metrics, SyncConfig config, ObjectMapper mapper) {
        this.store = store;
        this.jobs = jobs;
        this.integrations = integrations;
        this.credentials = credentials;
        this.mappings = mappings;
        this.engine = engine;
        this.providers = providers;
        this.watermarks = watermarks;
        this.localRecords = localRecords;
        this.conflicts = conflicts;
        this.ledger = ledger;
        this.metrics = metrics;
        this.config = config;
        this.json = new JsonColumns(mapper);
        this.canonicalWriter = mapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public JobResult run(String jobId) {
        SyncJob job = jobs.findById(jobId)
            .orElseThrow(() -> new NotFoundException("Sync job not found: " + jobId));
        Instant now = Instant.now();

        if (job.status.isTerminal() || job.status == SyncJobStatus.RUNNING) {
            LOG.debugf("Job [%s] is %s, nothing to run", jobId, job.status);
            return JobResult.of(job);
        }
        if (!job.isDue(now)) {
            LOG.debugf("Job [%s] is not due until %s", jobId, job.nextAttemptAt);
            return JobResult.of(job);
        }
        if (!isHeadOfLine(job)) {
            LOG.debugf("Job [%s] waits for an earlier job of instance [%s]", jobId, job.instanceId);
            return JobResult.of(job);
        }

        MDC.put("instanceId", job.instanceId);
        MDC.put("jobId", job.id);
        try {
            if (job.cancelRequested) {
                finish(job, null, SyncJobStatus.CANCELLED, null, copyOf(job.stats));
                return JobResult.of(job);
            }
            return execute(job, now);
        } finally {
            MDC.remove("jobId");
            MDC.remove("instanceId");
        }
    }

    private JobResult execute(SyncJob job, Instant runStartedAt) {
        SyncStats before = copyOf(job.stats);
        job.status = SyncJobStatus.RUNNING;
        if (job.startedAt == null) {
            job.startedAt = runStartedAt;
        }
        job.nextAttemptAt = null;
        job.updatedAt = runStartedAt;
        jobs.update(job);
        ledger.recordStart(job.id, LedgerKind.SYNC_JOB);
        LOG.infof("Sync job [%s] started: %s %s attempt %d", job.id, job.direction.getValue(), job.entityTypes, job.attempt + 1);

        IntegrationInstance instance = null;
        try {
            instance = integrations.get(job.instanceId);
            if (instance.status != IntegrationStatus.ACTIVE) {
                finish(job, instance, SyncJobStatus.FAILED,
                    JobFailure.reauthorizationRequired("Integration instance is " + instance.status), before);
                return JobResult.of(job);
            }

            RunContext run = prepare(job, instance);
            for (String entityType : new TreeSet<>(job.entityTypes)) {
                if (job.isTargeted()) {
                    pullTargeted(job, run, entityType);
                    continue;
                }
                if (job.direction.pulls()) {
                    pull(job, run, entityType);
                }
                if (job.direction.pushes()) {
                    push(job, run, entityType);
                }
            }

            SyncJobStatus status = SyncJobStatus.SUCCEEDED;
            JobFailure failure = null;
            if (job.stats.hasFailures()) {
                if (job.stats.recordsWritten + job.stats.recordsDeduped > 0) {
                    status = SyncJobStatus.PARTIALLY_FAILED;
                } else {
                    status = SyncJobStatus.FAILED;
                    failure = JobFailure.allRecordsFailed(job.stats.recordsFailed);
                }
            }
            if (status != SyncJobStatus.FAILED && job.direction == SyncDirection.BIDIRECTIONAL && !job.isTargeted()) {
                advanceBidirectionalWatermarks(job, runStartedAt);
            }
            finish(job, instance, status, failure, before);
        } catch (JobCancelledException e) {
            LOG.infof("Sync job [%s] cancelled at a page boundary", job.id);
            finish(job, instance, SyncJobStatus.CANCELLED, null, before);
        } catch (CredentialNotFoundException | CredentialExpiredException e) {
            integrations.recordAuthFailure(job.instanceId, e.getMessage(), false);
            finish(job, instance, SyncJobStatus.FAILED, JobFailure.reauthorizationRequired(e.getMessage()), before);
        } catch (EncryptionException e) {
            LOG.errorf(e, "Credential of instance [%s] could not be decrypted", job.instanceId);
            finish(job, instance, SyncJobStatus.FAILED,
                JobFailure.configurationError("The stored credential could not be decrypted"), before);
        } catch (ProviderAuthException e) {
            integrations.recordAuthFailure(job.instanceId, e.getMessage(), e.isRevoked());
            finish(job, instance, SyncJobStatus.FAILED, JobFailure.reauthorizationRequired(e.getMessage()), before);
        } catch (RateLimitedException e) {
            Duration delay = e.getRetryAfter().orElse(config.throttleDelay());
            LOG.warnf("Sync job [%s] throttled for %s: %s", job.id, delay, e.getMessage());
            metrics.jobThrottled(providerOf(instance));
            reschedule(job, instance, SyncJobStatus.THROTTLED, delay, before);
        } catch (ProviderUnavailableException e) {
            job.attempt++;
            if (job.attempt >= config.maxAttempts()) {
                LOG.errorf("Sync job [%s] gave up after %d attempts: %s", job.id, job.attempt, e.getMessage());
                finish(job, instance, SyncJobStatus.FAILED, JobFailure.targetUnreachable(e.getMessage()), before);
            } else {
                Duration delay = backoff(job.attempt);
                LOG.warnf("Sync job [%s] attempt %d hit a transient error, retrying in %s: %s",
                    job.id, job.attempt, delay, e.getMessage());
                reschedule(job, instance, SyncJobStatus.QUEUED, delay, before);
            }
        } catch (WatermarkConflictException e) {
            LOG.warnf("Sync job [%s] lost a watermark race, rescheduling: %s", job.id, e.getMessage());
            reschedule(job, instance, SyncJobStatus.QUEUED, config.conflictRetryDelay(), before);
        } catch (UnsupportedProviderException | MissingMappingException | ProviderRecordException e) {
            LOG.warnf("Sync job [%s] is misconfigured: %s", job.id, e.getMessage());
            finish(job, instance, SyncJobStatus.FAILED, JobFailure.configurationError(e.getMessage()), before);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Sync job [%s] failed unexpectedly", job.id);
            finish(job, instance, SyncJobStatus.FAILED, JobFailure.internalError(e.getMessage()), before);
        }
        return JobResult.of(job);
    }

    private RunContext prepare(SyncJob job, IntegrationInstance instance) {
        ProviderClient client = providers.clientFor(instance.providerType);

        Map<String, Integer> pinned = job.mappingVersions == null ? new HashMap<>() : new HashMap<>(job.mappingVersions);
        Map<String, FieldMappingVersion> resolved = new HashMap<>();
        for (String entityType : job.entityTypes) {
            if (job.direction.pulls()) {
                resolved.put(mappingKey(MappingDirection.INBOUND, entityType),
                    resolveMapping(job, pinned, entityType, MappingDirection.INBOUND));
            }
            if (job.direction.pushes() && !job.isTargeted()) {
                resolved.put(mappingKey(MappingDirection.OUTBOUND, entityType),
                    resolveMapping(job, pinned, entityType, MappingDirection.OUTBOUND));
            }
        }
        job.mappingVersions = pinned;

        CredentialRef ref = credentials.currentRef(instance.id);
        Credential credential = credentials.retrieve(ref, "sync-job:" + job.id);
        job.credentialRef = ref.id();
        jobs.update(job);

        return new RunContext(new ProviderContext(instance, credential), client,
            integrations.conflictPolicyFor(instance), resolved, new HashSet<>());
    }

    private FieldMappingVersion resolveMapping(SyncJob job, Map<String, Integer> pinned,
                                               String entityType, MappingDirection direction) {
        FieldMappingVersion active = mappings.activeFor(job.instanceId, entityType, direction)
            .orElseThrow(() -> new MissingMappingException(
                "No active " + direction + " mapping for entity type " + entityType));
        Integer pinnedVersion = pinned.get(active.id);
        if (pinnedVersion != null && pinnedVersion != active.version) {
            return mappings.findVersion(active.id, pinnedVersion)
                .orElseThrow(() -> new MissingMappingException(
                    "Mapping " + active.id + " version " + pinnedVersion + " no longer exists"));
        }
        pinned.put(active.id, active.version);
        return active;
    }

    private void pull(SyncJob job, RunContext run, String entityType) {
        String watermarkKey = Watermark.pullKey(entityType);
        String cursorKey = JobCursor.pullKey(entityType);
        Optional<Watermark> watermark = watermarks.find(job.instanceId, watermarkKey);
        long version = watermark.map(Watermark::version).orElse(0L);
        String cursor = job.cursor.get(cursorKey);
        if (cursor == null) {
            cursor = watermark.map(Watermark::cursor).orElse(null);
        }

        FieldMappingVersion mapping = run.mapping(MappingDirection.INBOUND, entityType);
        ConflictCheck check = conflictCheck(job, entityType);
        boolean hasMore = true;
        while (hasMore) {
            checkCancelled(job);
            String requested = cursor;
            RecordPage page = run.client().fetchChanges(run.context(), entityType, requested, config.pageSize());
            for (ExternalRecord record : page.records()) {
                processInbound(job, run, mapping, entityType, record, check);
            }
            for (MalformedRecord malformed : page.malformed()) {
                job.stats.recordsRead++;
                recordFailure(job, entityType, malformed.externalId() == null ? "<no id>" : malformed.externalId(),
                    malformed.reason());
            }
            boolean advanced = page.nextCursor() != null && !page.nextCursor().equals(requested);
            if (advanced) {
                cursor = page.nextCursor();
                version = checkpoint(job, watermarkKey, cursorKey, version, cursor);
            } else {
                jobs.update(job);
            }
            if (page.hasMore() && !advanced) {
                LOG.warnf("Provider reported more %s pages without a new cursor, stopping the pull", entityType);
            }
            hasMore = page.hasMore() && advanced;
        }
    }

    private void pullTargeted(SyncJob job, RunContext run, String entityType) {
        FieldMappingVersion mapping = run.mapping(MappingDirection.INBOUND, entityType);
        ConflictCheck check = conflictCheck(job, entityType);
        for (String externalId : job.targetExternalIds) {
            checkCancelled(job);
            Optional<ExternalRecord> record;
            try {
                record = run.client().fetchRecord(run.context(), entityType, externalId);
            } catch (ProviderRecordException e) {
                recordFailure(job, entityType, externalId, e.getMessage());
                continue;
            }
            if (record.isEmpty()) {
                LOG.infof("Record %s/%s no longer exists at the provider", entityType, externalId);
                continue;
            }
            processInbound(job, run, mapping, entityType, record.get(), check);
        }
        jobs.update(job);
    }

    private void processInbound(SyncJob job, RunContext run, FieldMappingVersion mapping, String entityType,
                                ExternalRecord record, ConflictCheck check) {
        String externalId = record.externalId();
        job.stats.recordsRead++;

        if (!run.seen().add(entityType + ":" + externalId)) {
            LOG.debugf("Record %s/%s returned twice in one job, skipped", entityType, externalId);
            job.stats.recordsDeduped++;
            return;
        }
        String key = inboundKey(job.instanceId, entityType, record);
        if (ledger.isAlreadyProcessed(key)) {
            job.stats.recordsDeduped++;
            return;
        }

        TransformResult result = engine.transform(record.data(), mapping.mapping);
        if (!result.success()) {
            recordFailure(job, entityType, externalId, result.failureSummary());
            return;
        }
        if (!result.warnings().isEmpty()) {
            LOG.debugf("Record %s/%s transformed with %d warnings", entityType, externalId, result.warnings().size());
        }
        Map<String, Object> data = result.record();

        if (check.enabled()) {
            if (conflicts.hasOpenConflict(job.instanceId, entityType, externalId)) {
                LOG.infof("Record %s/%s awaits manual conflict review, skipped", entityType, externalId);
                return;
            }
            Optional<LocalRecord> local = localRecords.find(job.instanceId, entityType, externalId);
            if (local.isPresent() && changedLocallySince(local.get(), check.since())
                    && changedRemotelySince(record, check.since())) {
                resolveConflict(job, run, entityType, record, data, local.get(), key);
                return;
            }
        }

        store.inTransaction(conn -> {
            localRecords.applyRemote(job.instanceId, entityType, externalId, data, record.modifiedAt());
            ledger.markProcessed(key, job.id);
            return null;
        });
        job.stats.recordsWritten++;
    }

    private void resolveConflict(SyncJob job, RunContext run, String entityType, ExternalRecord record,
                                 Map<String, Object> sourceData, LocalRecord local, String key) {
        ConflictResolver.Decision decision = ConflictResolver.resolve(run.policy(),
            sourceData, record.modifiedAt(), local.data, local.localModifiedAt);
        ConflictResolution resolution = decision.resolution();
        Instant now = Instant.now();

        ConflictRecord conflict = new ConflictRecord();
        conflict.id = TsidGenerator.generate(EntityType.CONFLICT);
        conflict.instanceId = job.instanceId;
        conflict.jobId = job.id;
        conflict.entityType = entityType;
        conflict.entityId = record.externalId();
        conflict.sourceVersion = record.modifiedAt();
        conflict.targetVersion = local.localModifiedAt;
        conflict.sourceData = sourceData;
        conflict.targetData = local.data;
        conflict.policy = run.policy();
        conflict.resolution = resolution;
        conflict.createdAt = now;
        if (resolution != ConflictResolution.MANUAL_REQUIRED) {
            conflict.resolvedBy = "policy:" + run.policy().name();
            conflict.resolvedAt = now;
        }

        store.inTransaction(conn -> {
            conflicts.insert(conflict);
            switch (resolution) {
                case SOURCE_WINS -> localRecords.applyRemote(job.instanceId, entityType, record.externalId(),
                    decision.retained(), record.modifiedAt());
                case MERGE -> localRecords.saveLocalChange(job.instanceId, entityType, record.externalId(),
                    decision.retained(), now);
                case TARGET_WINS -> LOG.debugf("Local version of %s/%s kept for the push phase",
                    entityType, record.externalId());
                case MANUAL_REQUIRED -> LOG.debugf("Record %s/%s held for manual review",
                    entityType, record.externalId());
            }
            if (resolution != ConflictResolution.MANUAL_REQUIRED) {
                ledger.markProcessed(key, job.id);
            }
            return null;
        });

        job.stats.conflicts++;
        if (resolution == ConflictResolution.SOURCE_WINS || resolution == ConflictResolution.MERGE) {
            job.stats.recordsWritten++;
        }
        LOG.infof("Conflict [%s] on %s/%s resolved as %s under %s",
            conflict.id, entityType, record.externalId(), resolution, run.policy());
    }

    private void push(SyncJob job, RunContext run, String entityType) {
        String watermarkKey = Watermark.pushKey(entityType);
        String cursorKey = JobCursor.pushKey(entityType);
        long version = watermarks.find(job.instanceId, watermarkKey).map(Watermark::version).orElse(0L);
        String saved = job.cursor.get(cursorKey);
        long afterSeq = saved == null ? 0L : Long.parseLong(saved);

        FieldMappingVersion mapping = run.mapping(MappingDirection.OUTBOUND, entityType);
        while (true) {
            checkCancelled(job);
            List<LocalRecord> batch = localRecords.findDirty(job.instanceId, entityType, afterSeq, config.pageSize());
            if (batch.isEmpty()) {
                break;
            }
            for (LocalRecord local : batch) {
                afterSeq = local.changeSeq;
                pushRecord(job, run, mapping, entityType, local);
            }
            version = checkpoint(job, watermarkKey, cursorKey, version, Long.toString(afterSeq));
            if (batch.size() < config.pageSize()) {
                break;
            }
        }
    }

    private void pushRecord(SyncJob job, RunContext run, FieldMappingVersion mapping, String entityType, LocalRecord local) {
        job.stats.recordsRead++;
        if (conflicts.hasOpenConflict(job.instanceId, entityType, local.externalId)) {
            LOG.infof("Record %s/%s awaits manual conflict review, not pushed", entityType, local.externalId);
            return;
        }
        String key = "rec:" + job.instanceId + ":out:" + entityType + ":" + local.externalId + ":" + local.changeSeq;
        if (ledger.isAlreadyProcessed(key)) {
            localRecords.markSynced(job.instanceId, entityType, local.externalId, local.changeSeq, local.remoteModifiedAt);
            job.stats.recordsDeduped++;
            return;
        }

        TransformResult result = engine.transform(local.data, mapping.mapping);
        if (!result.success()) {
            recordFailure(job, entityType, local.externalId, result.failureSummary());
            return;
        }

        WriteResult written;
        try {
            written = run.client().write(run.context(), entityType, local.externalId, result.record());
        } catch (ProviderRecordException e) {
            recordFailure(job, entityType, local.externalId, e.getMessage());
            return;
        }
        Instant remoteModifiedAt = written.modifiedAt() != null ? written.modifiedAt() : Instant.now();
        store.inTransaction(conn -> {
            localRecords.markSynced(job.instanceId, entityType, local.externalId, local.changeSeq, remoteModifiedAt);
            ledger.markProcessed(key, job.id);
            return null;
        });
        job.stats.recordsWritten++;
    }

    /**
     * Commit a page: watermark, job cursor and ledger checkpoint move together.
     *
     * @return the new watermark version
     */
    private long checkpoint(SyncJob job, String watermarkKey, String cursorKey, long expectedVersion, String position) {
        String previous = job.cursor.get(cursorKey);
        try {
            return store.inTransaction(conn -> {
                long next = watermarks.advance(job.instanceId, watermarkKey, expectedVersion, position);
                job.cursor.put(cursorKey, position);
                job.updatedAt = Instant.now();
                jobs.update(job);
                ledger.recordCheckpoint(job.id, json.write(job.cursor));
                return next;
            });
        } catch (RuntimeException e) {
            job.cursor.put(cursorKey, previous);
            throw e;
        }
    }

    private void advanceBidirectionalWatermarks(SyncJob job, Instant runStartedAt) {
        for (String entityType : job.entityTypes) {
            String key = Watermark.bidirectionalKey(entityType);
            long version = watermarks.find(job.instanceId, key).map(Watermark::version).orElse(0L);
            watermarks.advance(job.instanceId, key, version, runStartedAt.toString());
        }
    }

    private ConflictCheck conflictCheck(SyncJob job, String entityType) {
        Optional<Instant> since = watermarks.find(job.instanceId, Watermark.bidirectionalKey(entityType))
            .map(watermark -> Instant.parse(watermark.cursor()));
        boolean enabled = job.direction == SyncDirection.BIDIRECTIONAL || since.isPresent();
        return new ConflictCheck(enabled, since.orElse(null));
    }

    private static boolean changedLocallySince(LocalRecord local, Instant since) {
        if (!local.dirty) {
            return false;
        }
        return since == null || local.localModifiedAt == null || local.localModifiedAt.isAfter(since);
    }

    private static boolean changedRemotelySince(ExternalRecord record, Instant since) {
        return since == null || record.modifiedAt() == null || record.modifiedAt().isAfter(since);
    }

    private void finish(SyncJob job, IntegrationInstance instance, SyncJobStatus status, JobFailure failure, SyncStats before) {
        Instant now = Instant.now();
        job.status = status;
        job.failure = failure;
        job.nextAttemptAt = null;
        job.completedAt = now;
        job.updatedAt = now;
        jobs.update(job);

        if (job.mappingVersions != null && !job.mappingVersions.isEmpty()) {
            mappings.lockVersions(job.mappingVersions);
        }
        integrations.recordSyncOutcome(job.instanceId, status, failure == null ? null : failure.message());
        ledger.recordTerminal(job.id, status.name(), job.stats);

        String provider = providerOf(instance);
        publishMetrics(provider, before, job.stats);
        metrics.jobCompleted(provider, status.name(),
            job.startedAt == null ? null : Duration.between(job.startedAt, now));

        if (failure != null) {
            LOG.warnf("Sync job [%s] %s with %s: %s", job.id, status, failure.code(), failure.message());
        } else {
            LOG.infof("Sync job [%s] %s: read=%d written=%d failed=%d deduped=%d conflicts=%d",
                job.id, status, job.stats.recordsRead, job.stats.recordsWritten, job.stats.recordsFailed,
                job.stats.recordsDeduped, job.stats.conflicts);
        }
    }

    private void reschedule(SyncJob job, IntegrationInstance instance, SyncJobStatus status, Duration delay, SyncStats before) {
        Instant now = Instant.now();
        job.status = status;
        job.nextAttemptAt = now.plus(delay);
        job.updatedAt = now;
        jobs.update(job);
        publishMetrics(providerOf(instance), before, job.stats);
    }

    private Duration backoff(int attempt) {
        long factor = 1L << Math.min(attempt - 1, 20);
        Duration delay = config.retryBaseDelay().multipliedBy(factor);
        return delay.compareTo(config.retryMaxDelay()) > 0 ? config.retryMaxDelay() : delay;
    }

    private void recordFailure(SyncJob job, String entityType, String externalId, String reason) {
        job.stats.recordsFailed++;
        if (job.recordErrors.size() < config.maxRecordErrors()) {
            job.recordErrors.add(new RecordError(entityType, externalId, reason));
        }
        LOG.warnf("Record %s/%s failed: %s", entityType, externalId, reason);
    }

    private void checkCancelled(SyncJob job) {
        if (jobs.isCancelRequested(job.id)) {
            job.cancelRequested = true;
            throw new JobCancelledException();
        }
    }

    private boolean isHeadOfLine(SyncJob job) {
        return jobs.findActiveByInstance(job.instanceId).stream()
            .findFirst()
            .map(head -> head.id.equals(job.id))
            .orElse(true);
    }

    private void publishMetrics(String provider, SyncStats before, SyncStats after) {
        metrics.recordsRead(provider, after.recordsRead - before.recordsRead);
        metrics.recordsWritten(provider, after.recordsWritten - before.recordsWritten);
        metrics.recordsFailed(provider, after.recordsFailed - before.recordsFailed);
        metrics.recordsDeduped(provider, after.recordsDeduped - before.recordsDeduped);
        metrics.conflictsDetected(provider, after.conflicts - before.conflicts);
    }

    private String inboundKey(String instanceId, String entityType, ExternalRecord record) {
        String version = record.modifiedAt() != null
            ? Long.toString(record.modifiedAt().toEpochMilli())
            : "h" + sha256(record.data());
        return "rec:" + instanceId + ":in:" + entityType + ":" + record.externalId() + ":" + version;
    }

    private String sha256(Map<String, Object> data) {
        try {
            byte[] canonical = canonicalWriter.writeValueAsBytes(data);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record data is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String providerOf(IntegrationInstance instance) {
        return instance == null ? "unknown" : instance.providerType.getValue();
    }

    private static String mappingKey(MappingDirection direction, String entityType) {
        return direction.name() + ":" + entityType;
    }

    private static SyncStats copyOf(SyncStats stats) {
        SyncStats copy = new SyncStats();
        copy.recordsRead = stats.recordsRead;
        copy.recordsWritten = stats.recordsWritten;
        copy.recordsFailed = stats.recordsFailed;
        copy.recordsDeduped = stats.recordsDeduped;
        copy.conflicts = stats.conflicts;
        return copy;
    }

    private record RunContext(ProviderContext context, ProviderClient client, ConflictPolicy policy,
                              Map<String, FieldMappingVersion> mappings, Set<String> seen) {

        FieldMappingVersion mapping(MappingDirection direction, String entityType) {
            return mappings.get(mappingKey(direction, entityType));
        }
    }

    /**
     * @param since end of the last successful bidirectional run, null before the first one
     */
    private record ConflictCheck(boolean enabled, Instant since) {
    }

    private static final class JobCancelledException extends RuntimeException {
        JobCancelledException() {
            super("Job cancelled");
        }
    }

    private static final class MissingMappingException extends RuntimeException {
        MissingMappingException(String message) {
            super(message);
        }
    }
}
