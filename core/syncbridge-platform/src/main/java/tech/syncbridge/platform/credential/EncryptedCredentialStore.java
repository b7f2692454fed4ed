package tech.syncbridge.platform.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.IntegrationInstanceRepository;
import tech.syncbridge.platform.shared.EntityType;
import tech.syncbridge.platform.shared.TsidGenerator;
import tech.syncbridge.platform.store.SyncStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Credential store backed by the sync store, encrypting with {@link CredentialCipher}.
 *
 * <p>Audit events go to the {@code credential_audit} table and to the
 * {@code syncbridge.audit} log category.</p>
 */
@ApplicationScoped
public class EncryptedCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(EncryptedCredentialStore.class);
    private static final Logger AUDIT = Logger.getLogger("syncbridge.audit");

    private final SyncStore store;
    private final CredentialRepository credentials;
    private final IntegrationInstanceRepository instances;
    private final CredentialCipher cipher;
    private final ObjectMapper mapper;
    private final Duration gracePeriod;

    @Inject
    public EncryptedCredentialStore(
            SyncStore store,
            CredentialRepository credentials,
            IntegrationInstanceRepository instances,
            CredentialCipher cipher,
            ObjectMapper mapper,
            @ConfigProperty(name = "syncbridge.credentials.grace-period", defaultValue = "15m") Duration gracePeriod) {
        this.store = store;
        this.credentials = credentials;
        this.instances = instances;
        this.cipher = cipher;
        this.mapper = mapper;
        this.gracePeriod = gracePeriod;
    }

    @Override
    public CredentialRef store(String instanceId, Credential credential, String actor) {
        try {
            CredentialRef ref = persistNewVersion(instanceId, credential);
            audit(instanceId, "STORE", actor, ref.version(), "OK");
            return ref;
        } catch (CredentialException e) {
            audit(instanceId, "STORE", actor, null, failure(e));
            throw e;
        }
    }

    @Override
    public CredentialRef rotate(String instanceId, Credential newCredential, String actor) {
        try {
            if (credentials.findActive(instanceId).isEmpty()) {
                throw new CredentialNotFoundException("No credential to rotate for instance " + instanceId);
            }
            CredentialRef ref = persistNewVersion(instanceId, newCredential);
            audit(instanceId, "ROTATE", actor, ref.version(), "OK");
            return ref;
        } catch (CredentialException e) {
            audit(instanceId, "ROTATE", actor, null, failure(e));
            throw e;
        }
    }

    @Override
    public Credential retrieve(String instanceId, String actor) {
        try {
            StoredCredential stored = credentials.findActive(instanceId)
                .orElseThrow(() -> new CredentialNotFoundException("No credential stored for instance " + instanceId));
            Credential credential = open(stored);
            audit(instanceId, "RETRIEVE", actor, stored.version, "OK");
            return credential;
        } catch (CredentialException e) {
            audit(instanceId, "RETRIEVE", actor, null, failure(e));
            throw e;
        }
    }

    @Override
    public Credential retrieve(CredentialRef ref, String actor) {
        try {
            StoredCredential stored = credentials.findById(ref.id())
                .orElseThrow(() -> new CredentialExpiredException(
                    "Credential version " + ref.version() + " of instance " + ref.instanceId() + " was purged"));
            if (stored.status == StoredCredential.Status.RETIRED
                    && stored.purgeAfter != null && !stored.purgeAfter.isAfter(Instant.now())) {
                throw new CredentialExpiredException(
                    "Credential version " + ref.version() + " of instance " + ref.instanceId() + " is past its grace window");
            }
            Credential credential = open(stored);
            audit(ref.instanceId(), "RETRIEVE", actor, stored.version, "OK");
            return credential;
        } catch (CredentialException e) {
            audit(ref.instanceId(), "RETRIEVE", actor, ref.version(), failure(e));
            throw e;
        }
    }

    @Override
    public Optional<String> webhookSecret(String instanceId, String actor) {
        Optional<StoredCredential> stored = credentials.findActive(instanceId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            Credential credential = decrypt(stored.get());
            audit(instanceId, "RETRIEVE_WEBHOOK_SECRET", actor, stored.get().version, "OK");
            return Optional.ofNullable(credential.webhookSecret());
        } catch (CredentialException e) {
            audit(instanceId, "RETRIEVE_WEBHOOK_SECRET", actor, stored.get().version, failure(e));
            throw e;
        }
    }

    @Override
    public CredentialRef currentRef(String instanceId) {
        return credentials.findActive(instanceId)
            .map(StoredCredential::toRef)
            .orElseThrow(() -> new CredentialNotFoundException("No credential stored for instance " + instanceId));
    }

    @Override
    public void purgeAll(String instanceId, String actor) {
        int removed = credentials.deleteByInstance(instanceId);
        audit(instanceId, "PURGE", actor, null, "OK removed=" + removed);
    }

    @Override
    public int purgeExpired() {
        int removed = credentials.deleteRetiredBefore(Instant.now());
        if (removed > 0) {
            LOG.infof("Purged %d retired credential versions past their grace window", removed);
        }
        return removed;
    }

    private CredentialRef persistNewVersion(String instanceId, Credential credential) {
        IntegrationInstance instance = instances.findById(instanceId)
            .orElseThrow(() -> new CredentialNotFoundException("Unknown integration instance " + instanceId));

        String ciphertext = cipher.encrypt(instance.tenantId, instanceId, serialize(credential));
        Instant now = Instant.now();

        return store.inTransaction(conn -> {
            credentials.retireActive(instanceId, now, now.plus(gracePeriod));

            StoredCredential stored = new StoredCredential();
            stored.id = TsidGenerator.generate(EntityType.CREDENTIAL);
            stored.instanceId = instanceId;
            stored.tenantId = instance.tenantId;
            stored.version = credentials.nextVersion(instanceId);
            stored.ciphertext = ciphertext;
            stored.status = StoredCredential.Status.ACTIVE;
            stored.expiresAt = credential.expiresAt();
            stored.createdAt = now;
            credentials.insert(stored);
            return stored.toRef();
        });
    }

    private Credential open(StoredCredential stored) {
        Credential credential = decrypt(stored);
        if (credential.isExpired(Instant.now())) {
            throw new CredentialExpiredException("Credential for instance " + stored.instanceId + " has expired");
        }
        return credential;
    }

    private Credential decrypt(StoredCredential stored) {
        String json = cipher.decrypt(stored.tenantId, stored.instanceId, stored.ciphertext);
        try {
            return mapper.readValue(json, Credential.class);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Stored credential for instance " + stored.instanceId + " is unreadable", e);
        }
    }

    private String serialize(Credential credential) {
        try {
            return mapper.writeValueAsString(credential);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Failed to serialize credential", e);
        }
    }

    private void audit(String instanceId, String action, String actor, Integer version, String outcome) {
        AUDIT.infof("credential %s instance=%s actor=%s version=%s outcome=%s", action, instanceId, actor, version, outcome);
        credentials.insertAudit(new CredentialAuditEntry(
            TsidGenerator.generate(EntityType.AUDIT_LOG), instanceId, action, actor, version, outcome, Instant.now()));
    }

    private static String failure(CredentialException e) {
        return "FAILED " + e.getClass().getSimpleName();
    }
}
