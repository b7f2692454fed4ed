package tech.syncbridge.platform.credential;

import java.time.Instant;
import java.util.List;

/**
 * Plaintext secret material for one integration instance.
 *
 * <p>Only lives in memory for the duration of a request or job. {@link #toString()}
 * never prints secret values.</p>
 *
 * @param webhookSecret shared HMAC secret or PEM public key used to verify inbound webhooks
 */
public record Credential(
    CredentialType type,
    String accessToken,
    String refreshToken,
    String apiKey,
    Instant expiresAt,
    List<String> scopes,
    String webhookSecret
) {
    public Credential {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static Credential oauth2(String accessToken, String refreshToken, Instant expiresAt, List<String> scopes) {
        return new Credential(CredentialType.OAUTH2, accessToken, refreshToken, null, expiresAt, scopes, null);
    }

    public static Credential apiKey(String apiKey) {
        return new Credential(CredentialType.API_KEY, null, null, apiKey, null, List.of(), null);
    }

    public Credential withWebhookSecret(String secret) {
        return new Credential(type, accessToken, refreshToken, apiKey, expiresAt, scopes, secret);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Value sent to the provider as the bearer token.
     */
    public String bearerToken() {
        return type == CredentialType.API_KEY ? apiKey : accessToken;
    }

    @Override
    public String toString() {
        return "Credential[type=" + type + ", expiresAt=" + expiresAt + ", scopes=" + scopes + "]";
    }
}
