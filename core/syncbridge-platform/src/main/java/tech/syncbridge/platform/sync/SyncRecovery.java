package tech.syncbridge.platform.sync;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;

/**
 * Re-queues jobs a crash left RUNNING. They resume from their last checkpointed cursor.
 * Only one node runs workers against a store, so every RUNNING job found at startup is orphaned.
 */
@ApplicationScoped
public class SyncRecovery {

    private static final Logger LOG = Logger.getLogger(SyncRecovery.class);

    private final SyncJobRepository jobs;

    @Inject
    public SyncRecovery(SyncJobRepository jobs) {
        this.jobs = jobs;
    }

    void onStart(@Observes StartupEvent ev) {
        int recovered = recoverOrphanedJobs();
        if (recovered > 0) {
            LOG.infof("Re-queued %d sync jobs interrupted by a restart", recovered);
        }
    }

    public int recoverOrphanedJobs() {
        List<SyncJob> orphaned = jobs.findByStatus(SyncJobStatus.RUNNING);
        Instant now = Instant.now();
        for (SyncJob job : orphaned) {
            job.status = SyncJobStatus.QUEUED;
            job.nextAttemptAt = null;
            job.updatedAt = now;
            jobs.update(job);
            LOG.infof("Sync job [%s] re-queued, resuming from %s", job.id,
                job.cursor.isEmpty() ? "the beginning" : job.cursor.positions());
        }
        return orphaned.size();
    }
}
