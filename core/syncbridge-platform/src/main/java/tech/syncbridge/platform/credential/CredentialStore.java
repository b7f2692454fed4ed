package tech.syncbridge.platform.credential;

import java.util.Optional;

/**
 * Encrypted secrets scoped to an integration instance.
 *
 * <p>Every call is audit-logged with the instance id and the actor, never with secret material.</p>
 */
public interface CredentialStore {

    /**
     * Encrypt and persist a credential as the instance's current version.
     * Any previous active version is retired with a grace window.
     *
     * @throws EncryptionException if the tenant key is unavailable
     */
    CredentialRef store(String instanceId, Credential credential, String actor);

    /**
     * Decrypt the instance's current credential.
     *
     * @throws CredentialNotFoundException if nothing is stored
     * @throws CredentialExpiredException if the token has expired
     */
    Credential retrieve(String instanceId, String actor);

    /**
     * Decrypt a pinned version. Retired versions remain readable until their grace window passes.
     */
    Credential retrieve(CredentialRef ref, String actor);

    /**
     * Atomically replace the current credential, keeping the old one for in-flight jobs.
     *
     * @throws CredentialNotFoundException if there is nothing to rotate
     */
    CredentialRef rotate(String instanceId, Credential newCredential, String actor);

    /**
     * Webhook secret or verification key of the current credential. Token expiry does not matter here.
     *
     * @return empty if nothing is stored or the credential carries no webhook secret
     */
    Optional<String> webhookSecret(String instanceId, String actor);

    /**
     * Current ref for an instance.
     *
     * @throws CredentialNotFoundException if nothing is stored
     */
    CredentialRef currentRef(String instanceId);

    /**
     * Delete every version for an instance (disconnect).
     */
    void purgeAll(String instanceId, String actor);

    /**
     * Delete retired versions whose grace window has passed.
     *
     * @return number of versions removed
     */
    int purgeExpired();
}
