package tech.syncbridge.platform.sync;

import java.time.Instant;
import java.util.Map;

/**
 * Produced when a bidirectional sync finds the same entity changed on both sides
 * since the last successful bidirectional run.
 *
 * <p>{@code sourceData} is the incoming record already transformed to the local schema.
 * A MANUAL_REQUIRED record stays open (no {@code resolvedAt}) until resolved through the API,
 * and blocks that entity from syncing in either direction meanwhile.</p>
 */
public class ConflictRecord {

    public String id;
    public String instanceId;
    public String jobId;
    public String entityType;
    public String entityId;

    /** Provider-side modification time. */
    public Instant sourceVersion;

    /** Local modification time. */
    public Instant targetVersion;

    public Map<String, Object> sourceData;
    public Map<String, Object> targetData;
    public ConflictPolicy policy;
    public ConflictResolution resolution;
    public String resolvedBy;
    public Instant createdAt;
    public Instant resolvedAt;

    public boolean isOpen() {
        return resolution == ConflictResolution.MANUAL_REQUIRED && resolvedAt == null;
    }
}
