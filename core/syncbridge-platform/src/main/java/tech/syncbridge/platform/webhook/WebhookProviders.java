package tech.syncbridge.platform.webhook;

import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.webhook.parser.GitHubPayloadParser;
import tech.syncbridge.platform.webhook.parser.HubSpotPayloadParser;
import tech.syncbridge.platform.webhook.parser.SalesforcePayloadParser;
import tech.syncbridge.platform.webhook.parser.WordPressPayloadParser;
import tech.syncbridge.platform.webhook.signature.HmacSignatureVerifier;
import tech.syncbridge.platform.webhook.signature.RsaSignatureVerifier;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit provider type to webhook capability map.
 */
public class WebhookProviders {

    private final Map<ProviderType, WebhookProvider> providers;

    public WebhookProviders(Collection<WebhookProvider> providers) {
        this.providers = new EnumMap<>(ProviderType.class);
        providers.forEach(provider -> this.providers.put(provider.type(), provider));
    }

    public static WebhookProviders defaults() {
        HmacSignatureVerifier hmac = new HmacSignatureVerifier();
        return new WebhookProviders(List.of(
            WebhookProvider.of(ProviderType.HUBSPOT, "X-Hub-Signature-256", hmac, new HubSpotPayloadParser()),
            WebhookProvider.of(ProviderType.GITHUB, "X-Hub-Signature-256", hmac, new GitHubPayloadParser()),
            WebhookProvider.of(ProviderType.WORDPRESS, "X-WP-Signature", hmac, new WordPressPayloadParser()),
            WebhookProvider.of(ProviderType.SALESFORCE, "X-SFDC-Signature", new RsaSignatureVerifier(),
                new SalesforcePayloadParser())));
    }

    public Optional<WebhookProvider> find(ProviderType type) {
        return Optional.ofNullable(providers.get(type));
    }
}
