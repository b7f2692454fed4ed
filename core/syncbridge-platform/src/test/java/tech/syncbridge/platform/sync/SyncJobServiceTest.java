package tech.syncbridge.platform.sync;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.PlatformFixture;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.mapping.MappingDirection;
import tech.syncbridge.platform.worker.WorkItem;
import tech.syncbridge.transform.mapping.DataType;
import tech.syncbridge.transform.mapping.FieldMapping;
import tech.syncbridge.transform.mapping.MappingRule;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SyncJobServiceTest {

    private PlatformFixture f;
    private IntegrationInstance instance;

    @BeforeEach
    void setUp() {
        f = new PlatformFixture();
        instance = f.activeInstance(null);
        f.mapping(instance.id, "contact", MappingDirection.INBOUND, FieldMapping.of("contacts-in",
            MappingRule.identity("id", "id", DataType.STRING)));
    }

    // ==================== Trigger ====================

    @Test
    @DisplayName("Trigger queues a manual job and offers it to the pool")
    void trigger_shouldQueueJob() {
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        assertThat(job.status).isEqualTo(SyncJobStatus.QUEUED);
        assertThat(job.trigger).isEqualTo(SyncTrigger.MANUAL);
        assertThat(f.jobService.get(job.id).entityTypes).containsExactly("contact");
        verify(f.pool).submit(new WorkItem.SyncJobWork(job.id, instance.id));
    }

    @Test
    @DisplayName("Only the oldest active job of an instance is offered to the pool")
    void trigger_shouldOfferOnlyHeadJob() {
        SyncJob first = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);
        SyncJob second = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        verify(f.pool, times(2)).submit(new WorkItem.SyncJobWork(first.id, instance.id));
        verify(f.pool, never()).submit(new WorkItem.SyncJobWork(second.id, instance.id));
        assertThat(f.jobService.hasActiveJob(instance.id)).isTrue();
    }

    @Test
    @DisplayName("Trigger rejects instances that are not connected")
    void trigger_shouldThrow_whenInstanceNotActive() {
        IntegrationInstance pending = f.integrations.create("tenant-1", "Not connected", ProviderType.HUBSPOT, null, null);

        assertThatThrownBy(() -> f.jobService.trigger(pending.id, Set.of("contact"), SyncDirection.PULL))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> f.jobService.trigger("int_missing", Set.of("contact"), SyncDirection.PULL))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Trigger needs entity types and a mapping for every direction it syncs")
    void trigger_shouldThrow_whenMappingMissing() {
        assertThatThrownBy(() -> f.jobService.trigger(instance.id, Set.of(), SyncDirection.PULL))
            .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> f.jobService.trigger(instance.id, Set.of("deal"), SyncDirection.PULL))
            .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.BIDIRECTIONAL))
            .isInstanceOf(BadRequestException.class)
            .hasMessageContaining("OUTBOUND");
    }

    @Test
    @DisplayName("A trigger ref produces at most one job")
    void enqueueTargeted_shouldReturnExistingJob_forSameTriggerRef() {
        SyncJob first = f.jobService.enqueueTargeted(instance.id, "contact", List.of("1", "2"), "whe_1");
        SyncJob again = f.jobService.enqueueTargeted(instance.id, "contact", List.of("1", "2"), "whe_1");

        assertThat(again.id).isEqualTo(first.id);
        assertThat(first.trigger).isEqualTo(SyncTrigger.WEBHOOK);
        assertThat(first.isTargeted()).isTrue();
        assertThat(f.jobService.list(instance.id, 10)).hasSize(1);
    }

    // ==================== Cancel ====================

    @Test
    @DisplayName("Cancelling a queued job finishes it at once and a finished job cannot be cancelled")
    void cancel_shouldCancelQueuedJob() {
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);

        SyncJob cancelled = f.jobService.cancel(job.id);

        assertThat(cancelled.status).isEqualTo(SyncJobStatus.CANCELLED);
        assertThat(cancelled.completedAt).isNotNull();
        assertThat(f.jobService.hasActiveJob(instance.id)).isFalse();
        assertThatThrownBy(() -> f.jobService.cancel(job.id)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> f.jobService.cancel("job_missing")).isInstanceOf(NotFoundException.class);
    }

    // ==================== Statistics ====================

    @Test
    @DisplayName("Statistics count jobs by status")
    void statistics_shouldCountJobsByStatus() {
        SyncJob job = f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);
        f.jobService.trigger(instance.id, Set.of("contact"), SyncDirection.PULL);
        f.jobService.cancel(job.id);

        SyncStatistics stats = f.jobService.statistics(instance.id);

        assertThat(stats.jobsByStatus())
            .containsEntry(SyncJobStatus.CANCELLED, 1L)
            .containsEntry(SyncJobStatus.QUEUED, 1L);
    }
}
