package tech.syncbridge.platform.sync;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.worker.SyncWorkerPool;
import tech.syncbridge.platform.worker.WorkerPoolConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Offers due jobs to the worker pool: queued jobs nobody submitted yet, throttled jobs whose
 * pause is over and jobs rescheduled after a transient failure.
 */
@ApplicationScoped
public class SyncJobPoller {

    private static final Logger LOG = Logger.getLogger(SyncJobPoller.class);

    @Inject
    SyncJobRepository jobs;

    @Inject
    SyncJobService jobService;

    @Inject
    SyncWorkerPool pool;

    @Inject
    WorkerPoolConfig config;

    @Scheduled(every = "${syncbridge.worker.poll-interval:5s}", identity = "sync-job-poll",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollDueJobs() {
        try {
            doPoll();
        } catch (Exception e) {
            LOG.errorf(e, "Error polling for due sync jobs");
        }
    }

    void doPoll() {
        List<SyncJob> active = jobs.findActive(config.batchSize());
        if (active.isEmpty()) {
            LOG.trace("No active sync jobs");
            pool.cleanupIdleQueues();
            return;
        }

        // Jobs arrive oldest first, so the first job per instance is its head of line
        Map<String, List<SyncJob>> byInstance = active.stream()
            .collect(Collectors.groupingBy(job -> job.instanceId, LinkedHashMap::new, Collectors.toList()));

        int submitted = 0;
        for (String instanceId : byInstance.keySet()) {
            if (jobService.dispatchNext(instanceId)) {
                submitted++;
            }
        }
        if (submitted > 0) {
            LOG.debugf("Submitted %d sync jobs across %d instances", submitted, byInstance.size());
        }
        pool.cleanupIdleQueues();
    }
}
