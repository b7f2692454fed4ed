package tech.syncbridge.platform.sync;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.IntegrationService;

import java.time.Instant;
import java.util.LinkedHashSet;

/**
 * Queues recurring syncs for instances whose schedule is due. An instance that already has an
 * active job is skipped until that job is done.
 */
@ApplicationScoped
public class SyncScheduler {

    private static final Logger LOG = Logger.getLogger(SyncScheduler.class);

    @Inject
    IntegrationService integrations;

    @Inject
    SyncJobService jobService;

    @Scheduled(every = "${syncbridge.sync.schedule-check-interval:1m}", identity = "sync-schedule",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void enqueueDueSchedules() {
        try {
            enqueueDue(Instant.now());
        } catch (Exception e) {
            LOG.errorf(e, "Error enqueuing scheduled syncs");
        }
    }

    int enqueueDue(Instant now) {
        int queued = 0;
        for (IntegrationInstance instance : integrations.findScheduled()) {
            if (!instance.isScheduleDue(now) || jobService.hasActiveJob(instance.id)) {
                continue;
            }
            try {
                SyncJob job = jobService.trigger(instance.id, new LinkedHashSet<>(instance.schedule.entityTypes()),
                    instance.schedule.direction(), SyncTrigger.SCHEDULED, null, null);
                integrations.markScheduled(instance.id, now);
                queued++;
                LOG.debugf("Scheduled sync [%s] queued for instance [%s]", job.id, instance.id);
            } catch (RuntimeException e) {
                LOG.warnf("Scheduled sync for instance [%s] not queued: %s", instance.id, e.getMessage());
            }
        }
        return queued;
    }
}
