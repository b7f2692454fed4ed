package tech.syncbridge.platform.credential;

/**
 * Handle to one stored credential version. Jobs hold a ref rather than the
 * secret so a rotation mid-job keeps the old version readable during the grace window.
 */
public record CredentialRef(String id, String instanceId, int version) {
}
