package tech.syncbridge.platform.ledger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Instant;

@ApplicationScoped
public class LedgerRetentionJob {

    @Inject
    JobLedger ledger;

    @Scheduled(every = "${syncbridge.ledger.compaction-interval:1h}", identity = "ledger-retention",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void compact() {
        ledger.compact(Instant.now());
    }
}
