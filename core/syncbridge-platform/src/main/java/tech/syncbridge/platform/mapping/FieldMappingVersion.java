package tech.syncbridge.platform.mapping;

import tech.syncbridge.transform.mapping.FieldMapping;

import java.time.Instant;

/**
 * One version of a stored field mapping.
 *
 * <p>A version becomes locked once a completed sync job used it; updates to a locked
 * mapping create a new version instead of changing it.</p>
 */
public class FieldMappingVersion {

    public String id;
    public int version;
    public String instanceId;
    public String entityType;
    public MappingDirection direction;
    public FieldMapping mapping;
    public boolean locked;
    public boolean active;
    public Instant createdAt;
}
