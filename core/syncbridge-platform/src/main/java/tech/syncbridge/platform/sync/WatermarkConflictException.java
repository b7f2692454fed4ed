package tech.syncbridge.platform.sync;

/**
 * A watermark was advanced by someone else since it was read. The job is rescheduled.
 */
public class WatermarkConflictException extends RuntimeException {

    public WatermarkConflictException(String instanceId, String key, long expectedVersion) {
        super("Watermark " + key + " of instance " + instanceId + " is no longer at version " + expectedVersion);
    }
}
