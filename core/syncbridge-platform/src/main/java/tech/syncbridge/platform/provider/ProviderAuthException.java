package tech.syncbridge.platform.provider;

/**
 * The provider rejected the credential. Never retried automatically.
 */
public class ProviderAuthException extends ProviderException {

    private final boolean revoked;

    public ProviderAuthException(String message, boolean revoked) {
        super(message);
        this.revoked = revoked;
    }

    /**
     * True when the provider reports that access was revoked rather than merely expired.
     */
    public boolean isRevoked() {
        return revoked;
    }
}
