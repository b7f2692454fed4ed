package tech.syncbridge.platform.provider;

import tech.syncbridge.platform.integration.ProviderType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Explicit provider type to client map.
 */
public class ProviderRegistry {

    private final Map<ProviderType, ProviderClient> clients;

    public ProviderRegistry(Map<ProviderType, ProviderClient> clients) {
        this.clients = clients.isEmpty() ? new EnumMap<>(ProviderType.class) : new EnumMap<>(clients);
    }

    /**
     * @throws UnsupportedProviderException if no client is configured for the provider
     */
    public ProviderClient clientFor(ProviderType providerType) {
        ProviderClient client = clients.get(providerType);
        if (client == null) {
            throw new UnsupportedProviderException(providerType);
        }
        return client;
    }

    public boolean supports(ProviderType providerType) {
        return clients.containsKey(providerType);
    }
}
