package tech.syncbridge.platform.integration;

/**
 * Lifecycle of an integration instance.
 *
 * PENDING_AUTH -> ACTIVE once a credential is stored; ACTIVE -> ERROR on repeated
 * authentication failures; any state -> REVOKED on disconnect or remote revocation.
 * Storing a fresh credential moves ERROR back to ACTIVE.
 */
public enum IntegrationStatus {
    PENDING_AUTH,
    ACTIVE,
    ERROR,
    REVOKED;

    public boolean canSync() {
        return this == ACTIVE;
    }
}
