package tech.syncbridge.platform.provider;

import tech.syncbridge.platform.integration.ProviderType;

/**
 * No client is configured for a provider. A configuration error.
 */
public class UnsupportedProviderException extends ProviderException {

    public UnsupportedProviderException(ProviderType providerType) {
        super("No endpoint configured for provider " + providerType.getValue());
    }
}
