package tech.syncbridge.platform.provider;

import java.util.Map;
import java.util.Optional;

/**
 * Access to one external platform's records.
 *
 * <p>Implementations classify failures: {@link ProviderAuthException} for rejected
 * credentials, {@link RateLimitedException} for throttling, {@link ProviderUnavailableException}
 * for timeouts and server errors, {@link ProviderRecordException} for a problem with a single record.</p>
 */
public interface ProviderClient {

    /**
     * Records of one entity type changed after {@code cursor}, a null cursor meaning from the beginning.
     */
    RecordPage fetchChanges(ProviderContext ctx, String entityType, String cursor, int pageSize);

    Optional<ExternalRecord> fetchRecord(ProviderContext ctx, String entityType, String externalId);

    WriteResult write(ProviderContext ctx, String entityType, String externalId, Map<String, Object> data);
}
