package tech.syncbridge.platform.webhook;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.worker.SyncWorkerPool;
import tech.syncbridge.platform.worker.WorkItem;
import tech.syncbridge.platform.worker.WorkerPoolConfig;

import java.time.Instant;
import java.util.List;

/**
 * Offers waiting webhook events to the worker pool: events whose retry is due and RECEIVED events
 * the pool never saw (accepted just before a restart). On startup, events a crash left PROCESSING
 * go back to RECEIVED.
 */
@ApplicationScoped
public class WebhookEventPoller {

    private static final Logger LOG = Logger.getLogger(WebhookEventPoller.class);

    @Inject
    WebhookEventRepository events;

    @Inject
    SyncWorkerPool pool;

    @Inject
    WorkerPoolConfig config;

    void onStart(@Observes StartupEvent ev) {
        int recovered = recoverOrphanedEvents();
        if (recovered > 0) {
            LOG.infof("Returned %d webhook events interrupted by a restart to RECEIVED", recovered);
        }
    }

    @Scheduled(every = "${syncbridge.worker.poll-interval:5s}", identity = "webhook-event-poll",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollDueEvents() {
        try {
            int submitted = submitDue(Instant.now());
            if (submitted > 0) {
                LOG.debugf("Submitted %d webhook events", submitted);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Error polling for due webhook events");
        }
    }

    int submitDue(Instant now) {
        int submitted = 0;
        // Receipt order; the pool keeps per-instance order from here
        for (WebhookEvent event : events.findDue(now, config.batchSize())) {
            if (pool.submit(new WorkItem.WebhookWork(event.id, event.instanceId))) {
                submitted++;
            }
        }
        return submitted;
    }

    int recoverOrphanedEvents() {
        List<WebhookEvent> orphaned = events.findByStatus(WebhookStatus.PROCESSING);
        Instant now = Instant.now();
        for (WebhookEvent event : orphaned) {
            event.status = WebhookStatus.RECEIVED;
            event.updatedAt = now;
            events.update(event);
        }
        return orphaned.size();
    }
}
