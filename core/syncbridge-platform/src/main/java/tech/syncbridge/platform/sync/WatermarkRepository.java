package tech.syncbridge.platform.sync;

import java.util.Optional;

public interface WatermarkRepository {

    Optional<Watermark> find(String instanceId, String key);

    /**
     * Move a watermark forward, presenting the version last read (0 when it did not exist yet).
     *
     * @return the new version
     * @throws WatermarkConflictException if the stored version differs from {@code expectedVersion}
     */
    long advance(String instanceId, String key, long expectedVersion, String cursor);
}
