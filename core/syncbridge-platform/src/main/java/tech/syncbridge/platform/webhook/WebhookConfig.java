package tech.syncbridge.platform.webhook;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@ConfigMapping(prefix = "syncbridge.webhook")
public interface WebhookConfig {

    /**
     * Window in which a redelivered payload (same hash, same instance) is treated as a duplicate.
     */
    @WithDefault("24h")
    Duration dedupeWindow();

    /**
     * Retries after the first failed attempt before an event is dead-lettered.
     */
    @WithDefault("5")
    int maxRetries();

    @WithDefault("10s")
    Duration retryBaseDelay();

    @WithDefault("1h")
    Duration retryMaxDelay();
}
