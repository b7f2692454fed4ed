package tech.syncbridge.platform.sync;

/**
 * Why a single record was not written.
 */
public record RecordError(String entityType, String externalId, String reason) {
}
