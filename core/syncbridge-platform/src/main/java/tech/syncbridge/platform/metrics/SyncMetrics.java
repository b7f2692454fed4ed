package tech.syncbridge.platform.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;

/**
 * Micrometer counters for sync jobs and webhook ingestion.
 * Meters are tagged by provider so dashboards can split per platform.
 */
@ApplicationScoped
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    @Inject
    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordsRead(String provider, long count) {
        increment("syncbridge.sync.records.read", provider, count);
    }

    public void recordsWritten(String provider, long count) {
        increment("syncbridge.sync.records.written", provider, count);
    }

    public void recordsFailed(String provider, long count) {
        increment("syncbridge.sync.records.failed", provider, count);
    }

    public void recordsDeduped(String provider, long count) {
        increment("syncbridge.sync.records.deduped", provider, count);
    }

    public void conflictsDetected(String provider, long count) {
        increment("syncbridge.sync.conflicts", provider, count);
    }

    public void jobCompleted(String provider, String status, Duration duration) {
        Counter.builder("syncbridge.sync.jobs")
            .tag("provider", provider)
            .tag("status", status)
            .register(meterRegistry)
            .increment();
        if (duration != null) {
            Timer.builder("syncbridge.sync.job.duration")
                .tag("provider", provider)
                .register(meterRegistry)
                .record(duration);
        }
    }

    public void jobThrottled(String provider) {
        increment("syncbridge.sync.jobs.throttled", provider, 1);
    }

    public void webhookReceived(String provider) {
        increment("syncbridge.webhook.received", provider, 1);
    }

    public void webhookDeduped(String provider) {
        increment("syncbridge.webhook.deduped", provider, 1);
    }

    public void webhookRejected(String provider, String reason) {
        Counter.builder("syncbridge.webhook.rejected")
            .tag("provider", provider)
            .tag("reason", reason)
            .register(meterRegistry)
            .increment();
    }

    public void webhookDeadLettered(String provider) {
        increment("syncbridge.webhook.dead_lettered", provider, 1);
    }

    private void increment(String name, String provider, long amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder(name)
            .tag("provider", provider)
            .register(meterRegistry)
            .increment(amount);
    }
}
