package tech.syncbridge.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * TSID generation for all entities.
 *
 * Format: "{prefix}_{tsid}" (e.g., "job_0HZXEQ5Y8JY5Z"). TSIDs are time sortable,
 * so ordering by ID follows creation order within a type.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    private TsidGenerator() {
        // Utility class
    }

    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Check that an ID carries the prefix of the expected type.
     */
    public static boolean isOfType(String typedId, EntityType type) {
        if (typedId == null) {
            return false;
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        return separatorIndex > 0 && EntityType.fromPrefix(typedId.substring(0, separatorIndex)) == type;
    }
}
