package tech.syncbridge.platform.webhook.parser;

import java.util.List;

/**
 * What a webhook says changed.
 *
 * @param entityType null when the event does not concern a syncable entity (pings, pushes)
 * @param entityRefs external ids of the changed records, empty when there are none
 */
public record ParsedWebhook(String eventType, String entityType, List<String> entityRefs) {

    public ParsedWebhook {
        entityRefs = entityRefs == null ? List.of() : List.copyOf(entityRefs);
    }

    public boolean hasTargets() {
        return entityType != null && !entityRefs.isEmpty();
    }
}
