package tech.syncbridge.platform.provider;

import tech.syncbridge.platform.credential.Credential;
import tech.syncbridge.platform.integration.IntegrationInstance;

/**
 * What a provider call needs: the instance being synced and its decrypted credential.
 */
public record ProviderContext(IntegrationInstance instance, Credential credential) {
}
