package tech.syncbridge.platform.provider;

import java.time.Instant;
import java.util.Map;

/**
 * A record as seen on the external platform.
 *
 * @param modifiedAt provider-side version marker, used for idempotency and conflict detection
 */
public record ExternalRecord(String entityType, String externalId, Instant modifiedAt, Map<String, Object> data) {
}
