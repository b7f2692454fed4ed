package tech.syncbridge.platform.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.credential.CredentialException;
import tech.syncbridge.platform.credential.CredentialStore;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.IntegrationService;
import tech.syncbridge.platform.integration.IntegrationStatus;
import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.metrics.SyncMetrics;
import tech.syncbridge.platform.shared.EntityType;
import tech.syncbridge.platform.shared.TsidGenerator;
import tech.syncbridge.platform.store.SyncStore;
import tech.syncbridge.platform.webhook.parser.MalformedPayloadException;
import tech.syncbridge.platform.webhook.parser.ParsedWebhook;
import tech.syncbridge.platform.worker.SyncWorkerPool;
import tech.syncbridge.platform.worker.WorkItem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Accepts untrusted inbound webhooks: verifies the signature, parses the payload, deduplicates
 * redeliveries and queues the event for asynchronous processing.
 *
 * <p>Events failing signature verification are never persisted. A payload already seen for the
 * same instance inside the dedupe window is stored as DEDUPED and not processed again.</p>
 */
@ApplicationScoped
public class WebhookIngestionService {

    private static final Logger LOG = Logger.getLogger(WebhookIngestionService.class);

    static final Set<WebhookStatus> DEDUPE_STATUSES = EnumSet.of(
        WebhookStatus.RECEIVED, WebhookStatus.PROCESSING, WebhookStatus.PROCESSED, WebhookStatus.FAILED);

    private final SyncStore store;
    private final WebhookEventRepository events;
    private final IntegrationService integrations;
    private final CredentialStore credentials;
    private final WebhookProviders providers;
    private final SyncWorkerPool pool;
    private final SyncMetrics metrics;
    private final WebhookConfig config;
    private final ObjectMapper mapper;

    @Inject
    public WebhookIngestionService(SyncStore store, WebhookEventRepository events, IntegrationService integrations,
                                   CredentialStore credentials, WebhookProviders providers, SyncWorkerPool pool,
                                   SyncMetrics metrics, WebhookConfig config, ObjectMapper mapper) {
        this.store = store;
        this.events = events;
        this.integrations = integrations;
        this.credentials = credentials;
        this.providers = providers;
        this.pool = pool;
        this.metrics = metrics;
        this.config = config;
        this.mapper = mapper;
    }

    public ReceiveOutcome receive(ProviderType providerType, String instanceId, byte[] rawBody, Map<String, String> headers) {
        String provider = providerType.getValue();
        Map<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitive.putAll(headers);

        Optional<WebhookProvider> capability = providers.find(providerType);
        if (capability.isEmpty()) {
            return reject(provider, RejectionReason.UNSUPPORTED_PROVIDER, "Provider " + provider + " does not send webhooks");
        }
        Optional<IntegrationInstance> found = integrations.find(instanceId);
        if (found.isEmpty()) {
            return reject(provider, RejectionReason.UNKNOWN_INSTANCE, "Unknown integration instance " + instanceId);
        }
        IntegrationInstance instance = found.get();
        if (instance.providerType != providerType) {
            return reject(provider, RejectionReason.PROVIDER_MISMATCH,
                "Integration instance " + instanceId + " is not a " + provider + " integration");
        }
        if (instance.status == IntegrationStatus.REVOKED) {
            return reject(provider, RejectionReason.INSTANCE_INACTIVE, "Integration instance " + instanceId + " was disconnected");
        }

        String signature = caseInsensitive.get(capability.get().signatureHeader());
        Optional<String> secret;
        try {
            secret = credentials.webhookSecret(instanceId, "webhook:" + provider);
        } catch (CredentialException e) {
            LOG.errorf(e, "Webhook secret of instance [%s] could not be read", instanceId);
            return reject(provider, RejectionReason.CREDENTIAL_UNAVAILABLE, "Webhook secret could not be read");
        }
        if (secret.isEmpty() || !capability.get().verifier().verify(rawBody, signature, secret.get())) {
            LOG.warnf("Invalid %s webhook signature for instance [%s]", provider, instanceId);
            return reject(provider, RejectionReason.INVALID_SIGNATURE, "Invalid webhook signature");
        }

        ParsedWebhook parsed;
        try {
            JsonNode payload = mapper.readTree(rawBody);
            if (payload == null || payload.isMissingNode()) {
                throw new MalformedPayloadException("Empty webhook body");
            }
            parsed = capability.get().parser().parse(payload, caseInsensitive);
        } catch (IOException | MalformedPayloadException e) {
            return reject(provider, RejectionReason.MALFORMED_PAYLOAD, "Malformed webhook payload: " + e.getMessage());
        }

        metrics.webhookReceived(provider);
        WebhookEvent event = persist(instance, rawBody, parsed);
        if (event.status == WebhookStatus.DEDUPED) {
            metrics.webhookDeduped(provider);
            LOG.infof("Webhook event [%s] for instance [%s] is a redelivery, deduped", event.id, instanceId);
        } else {
            LOG.infof("Webhook event [%s] %s received for instance [%s]", event.id, parsed.eventType(), instanceId);
            pool.submit(new WorkItem.WebhookWork(event.id, instanceId));
        }
        return new ReceiveOutcome.Accepted(event.id, event.status);
    }

    private WebhookEvent persist(IntegrationInstance instance, byte[] rawBody, ParsedWebhook parsed) {
        Instant now = Instant.now();
        WebhookEvent event = new WebhookEvent();
        event.id = TsidGenerator.generate(EntityType.WEBHOOK_EVENT);
        event.instanceId = instance.id;
        event.provider = instance.providerType;
        event.eventType = parsed.eventType();
        event.entityType = parsed.entityType();
        event.entityRefs = parsed.entityRefs();
        event.payload = new String(rawBody, StandardCharsets.UTF_8);
        event.payloadHash = sha256(rawBody);
        event.signatureValid = true;
        event.receivedAt = now;
        event.updatedAt = now;

        return store.inTransaction(conn -> {
            boolean duplicate = events.findDuplicate(instance.id, event.payloadHash,
                now.minus(config.dedupeWindow()), DEDUPE_STATUSES).isPresent();
            event.status = duplicate ? WebhookStatus.DEDUPED : WebhookStatus.RECEIVED;
            if (duplicate) {
                event.processedAt = now;
            }
            events.insert(event);
            return event;
        });
    }

    private ReceiveOutcome reject(String provider, RejectionReason reason, String message) {
        metrics.webhookRejected(provider, reason.name());
        LOG.debugf("Webhook rejected (%s): %s", reason, message);
        return new ReceiveOutcome.Rejected(reason, message);
    }

    static String sha256(byte[] body) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
