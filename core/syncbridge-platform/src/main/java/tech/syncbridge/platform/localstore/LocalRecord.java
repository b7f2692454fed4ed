package tech.syncbridge.platform.localstore;

import java.time.Instant;
import java.util.Map;

/**
 * A record in the local store, the target of pulls and the source of pushes.
 *
 * <p>{@code dirty} marks a local change that has not been pushed yet. {@code changeSeq}
 * increases with every write and orders pushes.</p>
 */
public class LocalRecord {

    public String instanceId;
    public String entityType;
    public String externalId;
    public Map<String, Object> data;
    public long changeSeq;
    public boolean dirty;
    public Instant localModifiedAt;
    public Instant remoteModifiedAt;
    public Instant syncedAt;
}
