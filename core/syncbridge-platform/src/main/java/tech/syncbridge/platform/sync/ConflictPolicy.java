package tech.syncbridge.platform.sync;

/**
 * How a bidirectional sync settles an entity changed on both sides since the
 * last successful bidirectional run.
 */
public enum ConflictPolicy {
    /** Newer modification time wins; ties go to the source. */
    MOST_RECENT_WINS,
    SOURCE_WINS,
    TARGET_WINS,
    /** Field-level merge, source values override on overlapping keys. */
    MERGE,
    /** Leave both sides untouched and park the entity until resolved by hand. */
    MANUAL_REVIEW
}
