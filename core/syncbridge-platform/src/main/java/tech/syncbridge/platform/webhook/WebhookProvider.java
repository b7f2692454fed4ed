package tech.syncbridge.platform.webhook;

import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.webhook.parser.WebhookPayloadParser;
import tech.syncbridge.platform.webhook.signature.SignatureVerifier;

/**
 * What ingestion needs to know about one provider's webhooks.
 */
public interface WebhookProvider {

    ProviderType type();

    /**
     * Request header carrying the signature.
     */
    String signatureHeader();

    SignatureVerifier verifier();

    WebhookPayloadParser parser();

    static WebhookProvider of(ProviderType type, String signatureHeader, SignatureVerifier verifier,
                              WebhookPayloadParser parser) {
        return new Standard(type, signatureHeader, verifier, parser);
    }

    record Standard(ProviderType type, String signatureHeader, SignatureVerifier verifier,
                    WebhookPayloadParser parser) implements WebhookProvider {
    }
}
