package tech.syncbridge.platform.webhook;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface WebhookEventRepository {

    void insert(WebhookEvent event);

    void update(WebhookEvent event);

    Optional<WebhookEvent> findById(String id);

    /**
     * Earliest event of the instance with the same payload hash received at or after {@code since}
     * and currently in one of {@code statuses}.
     */
    Optional<WebhookEvent> findDuplicate(String instanceId, String payloadHash, Instant since,
                                         Collection<WebhookStatus> statuses);

    /**
     * RECEIVED events and FAILED events whose retry is due, in receipt order.
     */
    List<WebhookEvent> findDue(Instant now, int limit);

    List<WebhookEvent> findByStatus(WebhookStatus status);

    List<WebhookEvent> findByInstanceAndStatus(String instanceId, WebhookStatus status, int limit);

    Map<WebhookStatus, Long> countByStatus(String instanceId);
}
