package tech.syncbridge.platform.sync;

import java.time.Instant;

/**
 * How far syncs of one instance have progressed for one key ("pull:contacts",
 * "push:contacts", "bidi:contacts"). {@code version} guards concurrent advances.
 */
public record Watermark(String instanceId, String key, String cursor, long version, Instant updatedAt) {

    public static String pullKey(String entityType) {
        return "pull:" + entityType;
    }

    public static String pushKey(String entityType) {
        return "push:" + entityType;
    }

    public static String bidirectionalKey(String entityType) {
        return "bidi:" + entityType;
    }
}
