package tech.syncbridge.platform.ledger;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@ConfigMapping(prefix = "syncbridge.ledger")
public interface LedgerConfig {

    /**
     * Age after which completed work is compacted.
     */
    @WithDefault("30d")
    Duration retention();

    /**
     * Age after which failed jobs and dead-lettered events are compacted.
     */
    @WithDefault("90d")
    Duration failureRetention();

    @WithDefault("1h")
    Duration compactionInterval();
}
