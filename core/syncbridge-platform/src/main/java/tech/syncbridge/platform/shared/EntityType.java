package tech.syncbridge.platform.shared;

import java.util.HashMap;
import java.util.Map;

/**
 * Entity types with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.SYNC_JOB);  // "job_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    INTEGRATION_INSTANCE("int"),
    CREDENTIAL("crd"),
    FIELD_MAPPING("map"),
    SYNC_JOB("job"),
    WEBHOOK_EVENT("whk"),
    CONFLICT("cfl"),
    AUDIT_LOG("aud");

    private final String prefix;

    private static final Map<String, EntityType> BY_PREFIX = new HashMap<>();

    static {
        for (EntityType type : values()) {
            BY_PREFIX.put(type.prefix, type);
        }
    }

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * @return the EntityType for a prefix, or null if not found
     */
    public static EntityType fromPrefix(String prefix) {
        return BY_PREFIX.get(prefix);
    }
}
