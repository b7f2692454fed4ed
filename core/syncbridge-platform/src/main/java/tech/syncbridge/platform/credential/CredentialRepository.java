package tech.syncbridge.platform.credential;

import java.time.Instant;
import java.util.Optional;

public interface CredentialRepository {

    void insert(StoredCredential credential);

    Optional<StoredCredential> findActive(String instanceId);

    Optional<StoredCredential> findById(String id);

    int nextVersion(String instanceId);

    /**
     * Retire the active version of an instance.
     */
    void retireActive(String instanceId, Instant retiredAt, Instant purgeAfter);

    int deleteByInstance(String instanceId);

    int deleteRetiredBefore(Instant cutoff);

    void insertAudit(CredentialAuditEntry entry);
}
