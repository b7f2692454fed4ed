package tech.syncbridge.platform.provider;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.ProviderType;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client-side rate limiters, one per provider and instance.
 *
 * <p>Limiters never block: an exhausted limiter raises {@link RateLimitedException} so
 * the job is throttled like it would be on a provider 429.</p>
 */
public class ProviderRateLimiters {

    private static final Logger LOG = Logger.getLogger(ProviderRateLimiters.class);

    /**
     * Published API limits of each provider.
     */
    public static final Map<ProviderType, Limit> DEFAULT_LIMITS = Map.of(
        ProviderType.HUBSPOT, new Limit(100, Duration.ofSeconds(10)),
        ProviderType.SALESFORCE, new Limit(5000, Duration.ofHours(1)),
        ProviderType.GITHUB, new Limit(5000, Duration.ofHours(1)),
        ProviderType.WORDPRESS, new Limit(60, Duration.ofMinutes(1))
    );

    public record Limit(int limitForPeriod, Duration period) {
    }

    private final Map<ProviderType, Limit> limits;
    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    public ProviderRateLimiters(Map<ProviderType, Limit> limits) {
        this.limits = Map.copyOf(limits);
    }

    /**
     * Take one permit for a call on behalf of an instance.
     *
     * @throws RateLimitedException if the limiter for this provider and instance is exhausted
     */
    public void acquire(ProviderType provider, String instanceId) {
        RateLimiter limiter = limiters.computeIfAbsent(provider.getValue() + ":" + instanceId,
            name -> createRateLimiter(name, provider));
        if (!limiter.acquirePermission()) {
            Duration wait = limitFor(provider).period();
            LOG.debugf("Local rate limit reached for [%s], backing off %s", limiter.getName(), wait);
            throw new RateLimitedException("Local rate limit reached for " + provider.getValue(), wait);
        }
    }

    Limit limitFor(ProviderType provider) {
        return limits.getOrDefault(provider, DEFAULT_LIMITS.get(provider));
    }

    private RateLimiter createRateLimiter(String name, ProviderType provider) {
        Limit limit = limitFor(provider);
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitRefreshPeriod(limit.period())
            .limitForPeriod(limit.limitForPeriod())
            .timeoutDuration(Duration.ZERO)
            .build();
        return RateLimiter.of(name, config);
    }
}
