package tech.syncbridge.platform.provider;

import java.time.Duration;
import java.util.Optional;

/**
 * The provider, or the local limiter for it, asked us to slow down.
 */
public class RateLimitedException extends ProviderException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
