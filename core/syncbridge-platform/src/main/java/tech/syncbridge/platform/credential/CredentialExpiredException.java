package tech.syncbridge.platform.credential;

/**
 * The credential's token expired, or a pinned version was retired and purged.
 */
public class CredentialExpiredException extends CredentialException {

    public CredentialExpiredException(String message) {
        super(message);
    }
}
