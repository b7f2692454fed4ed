package tech.syncbridge.platform.webhook;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.worker.SyncWorkerPool;
import tech.syncbridge.platform.worker.WorkItem;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Inspection and manual replay of webhook events.
 */
@ApplicationScoped
public class WebhookEventService {

    private static final Logger LOG = Logger.getLogger(WebhookEventService.class);

    private final WebhookEventRepository events;
    private final SyncWorkerPool pool;

    @Inject
    public WebhookEventService(WebhookEventRepository events, SyncWorkerPool pool) {
        this.events = events;
        this.pool = pool;
    }

    public WebhookEvent get(String id) {
        return events.findById(id).orElseThrow(() -> new NotFoundException("Webhook event not found: " + id));
    }

    public List<WebhookEvent> deadLetters(String instanceId, int limit) {
        return events.findByInstanceAndStatus(instanceId, WebhookStatus.DEAD_LETTERED, limit);
    }

    public Map<WebhookStatus, Long> statistics(String instanceId) {
        return events.countByStatus(instanceId);
    }

    /**
     * Send a dead-lettered or failed event through processing again with a fresh retry budget.
     *
     * @throws IllegalStateException if the event is not DEAD_LETTERED or FAILED
     */
    public WebhookEvent replay(String id) {
        WebhookEvent event = get(id);
        if (event.status != WebhookStatus.DEAD_LETTERED && event.status != WebhookStatus.FAILED) {
            throw new IllegalStateException("Webhook event " + id + " is " + event.status + " and cannot be replayed");
        }
        event.status = WebhookStatus.RECEIVED;
        event.retryCount = 0;
        event.nextAttemptAt = null;
        event.updatedAt = Instant.now();
        events.update(event);
        pool.submit(new WorkItem.WebhookWork(event.id, event.instanceId));
        LOG.infof("Webhook event [%s] queued for replay", id);
        return event;
    }
}
