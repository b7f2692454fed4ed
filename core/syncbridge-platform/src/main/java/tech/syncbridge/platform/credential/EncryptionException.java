package tech.syncbridge.platform.credential;

/**
 * The encryption key is unavailable or a cipher operation failed.
 */
public class EncryptionException extends CredentialException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
