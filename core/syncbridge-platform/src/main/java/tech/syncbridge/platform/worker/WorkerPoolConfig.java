package tech.syncbridge.platform.worker;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@ConfigMapping(prefix = "syncbridge.worker")
public interface WorkerPoolConfig {

    /**
     * Concurrent workers. Jobs of different instances run in parallel up to this bound.
     */
    @WithDefault("4")
    int workers();

    /**
     * How often pollers look for due jobs and events.
     */
    @WithDefault("5s")
    Duration pollInterval();

    /**
     * Maximum items a poller loads per pass.
     */
    @WithDefault("50")
    int batchSize();

    @WithDefault("30s")
    Duration shutdownTimeout();
}
