package tech.syncbridge.platform.sync;

public enum ConflictResolution {
    SOURCE_WINS,
    TARGET_WINS,
    MERGE,
    MANUAL_REQUIRED
}
