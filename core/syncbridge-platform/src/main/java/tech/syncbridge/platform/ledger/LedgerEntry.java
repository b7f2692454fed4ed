package tech.syncbridge.platform.ledger;

import java.time.Instant;

/**
 * Durable record of one unit of work (a sync job run or a webhook delivery).
 */
public record LedgerEntry(
    String id,
    LedgerKind kind,
    String status,
    String cursor,
    String statsJson,
    Instant startedAt,
    Instant checkpointAt,
    Instant completedAt
) {
}
