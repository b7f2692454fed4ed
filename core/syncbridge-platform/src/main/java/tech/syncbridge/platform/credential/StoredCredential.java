package tech.syncbridge.platform.credential;

import java.time.Instant;

/**
 * One encrypted credential version as persisted.
 */
public class StoredCredential {

    public enum Status {
        ACTIVE,
        RETIRED
    }

    public String id;
    public String instanceId;
    public String tenantId;
    public int version;
    public String ciphertext;
    public Status status;
    public Instant expiresAt;
    public Instant createdAt;
    public Instant retiredAt;

    /**
     * Retired versions stay readable until this instant.
     */
    public Instant purgeAfter;

    public CredentialRef toRef() {
        return new CredentialRef(id, instanceId, version);
    }
}
