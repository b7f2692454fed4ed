package tech.syncbridge.platform.store;

/**
 * Unrecoverable failure of the underlying store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
