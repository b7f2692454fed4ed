package tech.syncbridge.platform.provider;

/**
 * The provider refused a single record (validation error, not found on write, ...).
 * Counted against the record; the job continues.
 */
public class ProviderRecordException extends ProviderException {

    private final int statusCode;

    public ProviderRecordException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
