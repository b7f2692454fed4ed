package tech.syncbridge.platform.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.PlatformFixture;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.IntegrationStatus;
import tech.syncbridge.platform.localstore.LocalRecord;
import tech.syncbridge.platform.mapping.MappingDirection;
import tech.syncbridge.platform.provider.ExternalRecord;
import tech.syncbridge.platform.provider.MalformedRecord;
import tech.syncbridge.platform.provider.ProviderAuthException;
import tech.syncbridge.platform.provider.ProviderUnavailableException;
import tech.syncbridge.platform.provider.RateLimitedException;
import tech.syncbridge.transform.mapping.DataType;
import tech.syncbridge.transform.mapping.FieldMapping;
import tech.syncbridge.transform.mapping.MappingRule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SyncOrchestratorTest {

    private static final Instant BASE = Instant.parse("2024-03-01T08:00:00Z");

    private PlatformFixture f;
    private IntegrationInstance instance;

    @BeforeEach
    void setUp() {
        f = new PlatformFixture();
        instance = f.activeInstance(null);
        f.mapping(instance.id, "contact", MappingDirection.INBOUND, FieldMapping.of("contacts-in",
            MappingRule.identity("id", "externalId", DataType.STRING).asRequired(),
            MappingRule.function("properties.email", "email", "normalize_email").asRequired()));
    }

    // ==================== Pull ====================

    @Test
    @DisplayName("Crash after two committed pages resumes at page three without rewriting anything")
    void run_shouldResumeFromCheckpoint_afterCrash() {
        addContacts(250);
        f.provider.failOnce("200", () -> {
            throw new SimulatedCrash();
        });
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        assertThatThrownBy(() -> f.orchestrator.run(job.id)).isInstanceOf(SimulatedCrash.class);

        SyncJob crashed = f.jobs.findById(job.id).orElseThrow();
        assertThat(crashed.status).isEqualTo(SyncJobStatus.RUNNING);
        assertThat(crashed.cursor.get(JobCursor.pullKey("contact"))).isEqualTo("200");
        assertThat(crashed.stats.recordsWritten).isEqualTo(200);

        assertThat(new SyncRecovery(f.jobs).recoverOrphanedJobs()).isEqualTo(1);
        f.provider.fetchedCursors.clear();

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.SUCCEEDED);
        assertThat(f.provider.fetchedCursors).containsExactly("200");
        assertThat(result.stats().recordsRead).isEqualTo(250);
        assertThat(result.stats().recordsWritten).isEqualTo(250);
        assertThat(result.stats().recordsDeduped).isZero();
        assertThat(f.localRecords.find(instance.id, "contact", "c0")).isPresent();
        assertThat(f.localRecords.find(instance.id, "contact", "c249")).isPresent();
        assertThat(f.ledger.find(job.id)).hasValueSatisfying(entry ->
            assertThat(entry.status()).isEqualTo("SUCCEEDED"));
    }

    @Test
    @DisplayName("A record missing a required field fails alone and the job is PARTIALLY_FAILED")
    void run_shouldCountRecordFailure_whenRequiredFieldMissing() {
        f.provider.add(contact(1, " A@B.COM "));
        f.provider.add(new ExternalRecord("contact", "c2", BASE.plusSeconds(2), Map.of("id", "c2")));
        f.provider.add(contact(3, "c@d.com"));
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.PARTIALLY_FAILED);
        assertThat(result.stats().recordsFailed).isEqualTo(1);
        assertThat(result.stats().recordsWritten).isEqualTo(2);
        assertThat(f.jobs.findById(job.id).orElseThrow().recordErrors)
            .extracting(RecordError::externalId)
            .containsExactly("c2");
        assertThat(f.localRecords.find(instance.id, "contact", "c1"))
            .hasValueSatisfying(record -> assertThat(record.data).containsEntry("email", "a@b.com"));
        assertThat(f.localRecords.find(instance.id, "contact", "c2")).isEmpty();
    }

    @Test
    @DisplayName("An unreadable provider entry fails alone and the rest of the page is written")
    void run_shouldCountMalformedEntry_andWriteRestOfPage() {
        f.provider.add(contact(1, "a@b.com"));
        f.provider.add(contact(3, "c@d.com"));
        f.provider.addMalformed("contact", new MalformedRecord(null, "record without id"));
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.PARTIALLY_FAILED);
        assertThat(result.stats().recordsRead).isEqualTo(3);
        assertThat(result.stats().recordsWritten).isEqualTo(2);
        assertThat(result.stats().recordsFailed).isEqualTo(1);
        assertThat(f.jobs.findById(job.id).orElseThrow().recordErrors)
            .extracting(RecordError::reason)
            .containsExactly("record without id");
        assertThat(f.localRecords.find(instance.id, "contact", "c3")).isPresent();
    }

    @Test
    @DisplayName("A provider repeating its cursor with more pages does not loop the pull")
    void run_shouldStopPull_whenCursorDoesNotAdvance() {
        addContacts(250);
        f.provider.stallAt = "100";
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.SUCCEEDED);
        assertThat(f.provider.fetchedCursors).containsExactly("null", "100");
        assertThat(result.stats().recordsRead).isEqualTo(200);
        assertThat(f.jobs.findById(job.id).orElseThrow().cursor.get(JobCursor.pullKey("contact"))).isEqualTo("100");
    }

    @Test
    @DisplayName("Every record failing is a FAILED job")
    void run_shouldFail_whenAllRecordsFail() {
        f.provider.add(new ExternalRecord("contact", "c1", BASE, Map.of("id", "c1")));
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(result.failure().code()).isEqualTo(JobFailure.ALL_RECORDS_FAILED);
    }

    @Test
    @DisplayName("Rate limiting pauses the job as THROTTLED and it completes after the delay without data loss")
    void run_shouldThrottleAndResume_whenRateLimited() {
        addContacts(250);
        f.provider.failOnce("100", () -> {
            throw new RateLimitedException("429 Too Many Requests", Duration.ofMillis(50));
        });
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult throttled = f.orchestrator.run(job.id);

        assertThat(throttled.status()).isEqualTo(SyncJobStatus.THROTTLED);
        assertThat(throttled.nextAttemptAt()).isNotNull();
        assertThat(throttled.stats().recordsWritten).isEqualTo(100);

        await().atMost(Duration.ofSeconds(5))
            .pollInterval(Duration.ofMillis(20))
            .until(() -> f.orchestrator.run(job.id).status() == SyncJobStatus.SUCCEEDED);

        SyncJob done = f.jobs.findById(job.id).orElseThrow();
        assertThat(done.stats.recordsWritten).isEqualTo(250);
        assertThat(done.stats.recordsFailed).isZero();
        assertThat(f.provider.fetchedCursors).containsExactly("null", "100", "100", "200");
    }

    @Test
    @DisplayName("A record returned twice by pagination is written once")
    void run_shouldDedupeRecordsWithinJob() {
        f.provider.add(contact(1, "a@b.com"));
        f.provider.add(contact(1, "a@b.com"));
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.SUCCEEDED);
        assertThat(result.stats().recordsRead).isEqualTo(2);
        assertThat(result.stats().recordsWritten).isEqualTo(1);
        assertThat(result.stats().recordsDeduped).isEqualTo(1);
    }

    @Test
    @DisplayName("A completed job locks the mapping version it used")
    void run_shouldLockMappingVersions() {
        f.provider.add(contact(1, "a@b.com"));
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        f.orchestrator.run(job.id);

        String mappingId = f.mappings.activeFor(instance.id, "contact", MappingDirection.INBOUND).orElseThrow().id;
        assertThat(f.jobs.findById(job.id).orElseThrow().mappingVersions).containsEntry(mappingId, 1);
        assertThat(f.mappings.get(mappingId).locked).isTrue();
    }

    // ==================== Failures ====================

    @Test
    @DisplayName("Remote token revocation fails the job and revokes the instance")
    void run_shouldRequireReauthorization_whenTokenRevoked() {
        f.provider.failOnce(null, () -> {
            throw new ProviderAuthException("token revoked", true);
        });
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(result.failure().code()).isEqualTo(JobFailure.REAUTHORIZATION_REQUIRED);
        assertThat(f.integrations.get(instance.id).status).isEqualTo(IntegrationStatus.REVOKED);
    }

    @Test
    @DisplayName("Transient provider errors reschedule the job until attempts run out")
    void run_shouldRetryThenFail_whenProviderUnavailable() {
        f.provider.failEveryFetch = () -> {
            throw new ProviderUnavailableException("503 Service Unavailable");
        };
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult first = f.orchestrator.run(job.id);

        assertThat(first.status()).isEqualTo(SyncJobStatus.QUEUED);
        assertThat(first.nextAttemptAt()).isAfter(Instant.now().minusSeconds(1));

        await().atMost(Duration.ofSeconds(5))
            .pollInterval(Duration.ofMillis(10))
            .until(() -> f.orchestrator.run(job.id).isTerminal());

        SyncJob failed = f.jobs.findById(job.id).orElseThrow();
        assertThat(failed.status).isEqualTo(SyncJobStatus.FAILED);
        assertThat(failed.failure.code()).isEqualTo(JobFailure.TARGET_UNREACHABLE);
        assertThat(failed.attempt).isEqualTo(3);
    }

    @Test
    @DisplayName("Cancellation stops a running job at the next page boundary and keeps committed pages")
    void run_shouldStopAtPageBoundary_whenCancelled() {
        addContacts(250);
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);
        f.provider.failOnce("100", () -> f.jobs.requestCancel(job.id));

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.CANCELLED);
        assertThat(result.stats().recordsWritten).isEqualTo(200);
        assertThat(f.provider.fetchedCursors).containsExactly("null", "100");
    }

    @Test
    @DisplayName("A later job of the same instance waits for the earlier one")
    void run_shouldWait_whenNotHeadOfLine() {
        SyncJob first = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);
        SyncJob second = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        JobResult result = f.orchestrator.run(second.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.QUEUED);
        assertThat(f.provider.fetchedCursors).isEmpty();

        assertThat(f.orchestrator.run(first.id).status()).isEqualTo(SyncJobStatus.SUCCEEDED);
        assertThat(f.orchestrator.run(second.id).status()).isEqualTo(SyncJobStatus.SUCCEEDED);
    }

    // ==================== Bidirectional ====================

    @Test
    @DisplayName("Both sides changed: the newer local version wins and is pushed")
    void run_shouldKeepNewerLocalVersion_underMostRecentWins() {
        bidirectionalMappings();
        Instant t1 = Instant.parse("2024-01-01T10:00:00Z");
        Instant t2 = Instant.parse("2024-01-01T11:00:00Z");
        f.localRecords.saveLocalChange(instance.id, "contact", "c1",
            Map.of("id", "c1", "email", "a@b.com", "name", "Local Name"), t2);
        f.provider.add(new ExternalRecord("contact", "c1", t1,
            Map.of("id", "c1", "email", "a@b.com", "name", "Remote Name")));
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.BIDIRECTIONAL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.SUCCEEDED);
        assertThat(result.stats().conflicts).isEqualTo(1);

        List<ConflictRecord> conflicts = f.conflictService.list(instance.id, false);
        assertThat(conflicts).hasSize(1);
        ConflictRecord conflict = conflicts.get(0);
        assertThat(conflict.resolution).isEqualTo(ConflictResolution.TARGET_WINS);
        assertThat(conflict.sourceVersion).isEqualTo(t1);
        assertThat(conflict.targetVersion).isEqualTo(t2);
        assertThat(conflict.resolvedBy).isEqualTo("policy:MOST_RECENT_WINS");

        LocalRecord local = f.localRecords.find(instance.id, "contact", "c1").orElseThrow();
        assertThat(local.data).containsEntry("name", "Local Name");
        assertThat(local.dirty).isFalse();
        assertThat(f.provider.written.get("contact:c1")).containsEntry("name", "Local Name");
        assertThat(f.watermarks.find(instance.id, Watermark.bidirectionalKey("contact"))).isPresent();
    }

    @Test
    @DisplayName("Manual review parks the entity, leaves both sides alone and resolves through the service")
    void run_shouldHoldEntity_underManualReview() {
        f = new PlatformFixture();
        instance = f.activeInstance(ConflictPolicy.MANUAL_REVIEW);
        bidirectionalMappings();
        Instant t1 = Instant.parse("2024-01-01T10:00:00Z");
        Instant t2 = Instant.parse("2024-01-01T11:00:00Z");
        f.localRecords.saveLocalChange(instance.id, "contact", "c1",
            Map.of("id", "c1", "email", "a@b.com", "name", "Local Name"), t2);
        f.provider.add(new ExternalRecord("contact", "c1", t1,
            Map.of("id", "c1", "email", "a@b.com", "name", "Remote Name")));
        f.provider.add(contact(2, "other@b.com"));
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.BIDIRECTIONAL);

        JobResult result = f.orchestrator.run(job.id);

        assertThat(result.status()).isEqualTo(SyncJobStatus.SUCCEEDED);
        assertThat(f.provider.written).doesNotContainKey("contact:c1");
        assertThat(f.localRecords.find(instance.id, "contact", "c2")).isPresent();
        LocalRecord held = f.localRecords.find(instance.id, "contact", "c1").orElseThrow();
        assertThat(held.data).containsEntry("name", "Local Name");
        assertThat(held.dirty).isTrue();

        ConflictRecord open = f.conflictService.list(instance.id, true).get(0);
        assertThat(open.isOpen()).isTrue();

        f.conflictService.resolve(open.id, ConflictResolution.SOURCE_WINS, "reviewer");

        LocalRecord resolved = f.localRecords.find(instance.id, "contact", "c1").orElseThrow();
        assertThat(resolved.data).containsEntry("name", "Remote Name");
        assertThat(resolved.dirty).isFalse();
        assertThat(f.conflicts.hasOpenConflict(instance.id, "contact", "c1")).isFalse();
    }

    private void bidirectionalMappings() {
        f.mappings.list(instance.id).forEach(mapping -> f.mappings.delete(mapping.id));
        f.mapping(instance.id, "contact", MappingDirection.INBOUND, FieldMapping.of("contacts-in",
            MappingRule.identity("id", "id", DataType.STRING).asRequired(),
            MappingRule.identity("email", "email", DataType.STRING),
            MappingRule.identity("name", "name", DataType.STRING)));
        f.mapping(instance.id, "contact", MappingDirection.OUTBOUND, FieldMapping.of("contacts-out",
            MappingRule.identity("email", "email", DataType.STRING),
            MappingRule.identity("name", "name", DataType.STRING)));
    }

    private void addContacts(int count) {
        for (int i = 0; i < count; i++) {
            f.provider.add(contact(i, "User" + i + "@Example.com"));
        }
    }

    private static ExternalRecord contact(int i, String email) {
        return new ExternalRecord("contact", "c" + i, BASE.plusSeconds(i),
            Map.of("id", "c" + i, "properties", Map.of("email", email)));
    }

    static class SimulatedCrash extends Error {
        SimulatedCrash() {
            super("simulated process crash");
        }
    }
}
