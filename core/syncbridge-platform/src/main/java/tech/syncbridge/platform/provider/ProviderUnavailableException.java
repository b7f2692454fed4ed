package tech.syncbridge.platform.provider;

/**
 * Timeout, connection failure or 5xx. Retryable.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
