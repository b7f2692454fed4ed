package tech.syncbridge.platform.sync;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Sync orchestration settings.
 */
@ConfigMapping(prefix = "syncbridge.sync")
public interface SyncConfig {

    /**
     * Records requested per provider page.
     */
    @WithDefault("100")
    int pageSize();

    /**
     * Runs allowed for a job hitting transient provider errors before it fails.
     */
    @WithDefault("5")
    int maxAttempts();

    @WithDefault("5s")
    Duration retryBaseDelay();

    @WithDefault("5m")
    Duration retryMaxDelay();

    /**
     * Delay before re-running a job that lost a watermark version check.
     */
    @WithDefault("10s")
    Duration conflictRetryDelay();

    /**
     * Pause used when a rate-limited provider does not say how long to wait.
     */
    @WithDefault("30s")
    Duration throttleDelay();

    @WithDefault("MOST_RECENT_WINS")
    ConflictPolicy defaultConflictPolicy();

    /**
     * Consecutive authentication failures before an instance moves to ERROR.
     */
    @WithDefault("1")
    int authFailureThreshold();

    /**
     * Per-record errors kept on a job; the failure counter is not capped.
     */
    @WithDefault("50")
    int maxRecordErrors();

    /**
     * How often instance schedules are checked for due syncs.
     */
    @WithDefault("1m")
    Duration scheduleCheckInterval();
}
