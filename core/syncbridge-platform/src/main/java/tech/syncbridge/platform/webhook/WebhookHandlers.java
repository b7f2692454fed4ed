package tech.syncbridge.platform.webhook;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.mapping.FieldMappingService;
import tech.syncbridge.platform.mapping.MappingDirection;
import tech.syncbridge.platform.sync.SyncJob;
import tech.syncbridge.platform.sync.SyncJobService;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handlers per {@code provider:event_type}. Every event first goes through the default handler,
 * which queues a targeted PULL of the changed records, then through any registered custom handlers.
 */
@ApplicationScoped
public class WebhookHandlers {

    private static final Logger LOG = Logger.getLogger(WebhookHandlers.class);

    private final SyncJobService jobService;
    private final FieldMappingService mappings;
    private final Map<String, List<WebhookEventHandler>> custom = new ConcurrentHashMap<>();

    @Inject
    public WebhookHandlers(SyncJobService jobService, FieldMappingService mappings) {
        this.jobService = jobService;
        this.mappings = mappings;
    }

    public void register(ProviderType provider, String eventType, WebhookEventHandler handler) {
        custom.computeIfAbsent(key(provider, eventType), k -> new CopyOnWriteArrayList<>()).add(handler);
        LOG.infof("Registered webhook handler for %s", key(provider, eventType));
    }

    public void dispatch(WebhookEvent event) {
        enqueueTargetedPull(event);
        for (WebhookEventHandler handler : custom.getOrDefault(key(event.provider, event.eventType), List.of())) {
            handler.handle(event);
        }
    }

    private void enqueueTargetedPull(WebhookEvent event) {
        if (event.entityType == null || event.entityRefs == null || event.entityRefs.isEmpty()) {
            LOG.debugf("Webhook event [%s] (%s) names no records, no sync queued", event.id, event.eventType);
            return;
        }
        if (mappings.activeFor(event.instanceId, event.entityType, MappingDirection.INBOUND).isEmpty()) {
            LOG.infof("Webhook event [%s] concerns %s, which instance [%s] does not sync",
                event.id, event.entityType, event.instanceId);
            return;
        }
        SyncJob job = jobService.enqueueTargeted(event.instanceId, event.entityType, event.entityRefs, event.id);
        LOG.infof("Webhook event [%s] queued sync job [%s] for %d %s records",
            event.id, job.id, event.entityRefs.size(), event.entityType);
    }

    private static String key(ProviderType provider, String eventType) {
        return provider.getValue() + ":" + eventType;
    }
}
