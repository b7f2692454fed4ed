package tech.syncbridge.platform.provider;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Provider endpoints and limits, keyed by provider name (hubspot, salesforce, ...).
 */
@ConfigMapping(prefix = "syncbridge.providers")
public interface ProviderConfig {

    /**
     * Bound on every provider request. A timeout is treated as a transient failure.
     */
    @WithDefault("30s")
    Duration requestTimeout();

    @WithDefault("10s")
    Duration connectTimeout();

    Map<String, Endpoint> endpoints();

    interface Endpoint {

        /**
         * Base URL of the provider's sync API.
         */
        Optional<String> baseUrl();

        /**
         * Requests allowed per rate period. Falls back to the provider's published limit.
         */
        Optional<Integer> rateLimit();

        Optional<Duration> ratePeriod();
    }
}
