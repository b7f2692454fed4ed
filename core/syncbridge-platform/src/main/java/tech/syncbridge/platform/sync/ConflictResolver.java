package tech.syncbridge.platform.sync;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies a {@link ConflictPolicy} to two versions of the same entity.
 */
public final class ConflictResolver {

    private ConflictResolver() {
        // Utility class
    }

    /**
     * @param resolution chosen outcome
     * @param retained   data to keep, null when the outcome is MANUAL_REQUIRED
     */
    public record Decision(ConflictResolution resolution, Map<String, Object> retained) {
    }

    public static Decision resolve(ConflictPolicy policy,
                                   Map<String, Object> sourceData, Instant sourceModifiedAt,
                                   Map<String, Object> targetData, Instant targetModifiedAt) {
        switch (policy) {
            case SOURCE_WINS:
                return new Decision(ConflictResolution.SOURCE_WINS, sourceData);
            case TARGET_WINS:
                return new Decision(ConflictResolution.TARGET_WINS, targetData);
            case MERGE:
                return new Decision(ConflictResolution.MERGE, merge(sourceData, targetData));
            case MANUAL_REVIEW:
                return new Decision(ConflictResolution.MANUAL_REQUIRED, null);
            case MOST_RECENT_WINS:
            default:
                if (isAfter(targetModifiedAt, sourceModifiedAt)) {
                    return new Decision(ConflictResolution.TARGET_WINS, targetData);
                }
                return new Decision(ConflictResolution.SOURCE_WINS, sourceData);
        }
    }

    /**
     * Target fields overlaid with source fields; nested maps merge recursively.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> merge(Map<String, Object> sourceData, Map<String, Object> targetData) {
        Map<String, Object> merged = new LinkedHashMap<>(targetData);
        sourceData.forEach((key, value) -> {
            Object existing = merged.get(key);
            if (existing instanceof Map && value instanceof Map) {
                merged.put(key, merge((Map<String, Object>) value, (Map<String, Object>) existing));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    private static boolean isAfter(Instant a, Instant b) {
        if (a == null) {
            return false;
        }
        return b == null || a.isAfter(b);
    }
}
