package tech.syncbridge.platform.integration;

import tech.syncbridge.platform.sync.SyncDirection;

import java.util.List;

/**
 * Recurring sync configured on an instance.
 */
public record SyncSchedule(
    List<String> entityTypes,
    SyncDirection direction,
    int intervalMinutes
) {
    public SyncSchedule {
        entityTypes = entityTypes == null ? List.of() : List.copyOf(entityTypes);
        if (direction == null) {
            direction = SyncDirection.PULL;
        }
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("Schedule interval must be positive");
        }
    }
}
