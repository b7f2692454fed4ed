package tech.syncbridge.platform.store;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the embedded SQLite store.
 */
@ConfigMapping(prefix = "syncbridge.store")
public interface StoreConfig {

    /**
     * Path of the SQLite database file. Use ":memory:" for a throwaway store.
     */
    @WithDefault("./syncbridge.db")
    String dbPath();

    /**
     * How long SQLite waits on a locked database before failing.
     */
    @WithDefault("5s")
    Duration busyTimeout();
}
