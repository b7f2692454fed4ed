package tech.syncbridge.platform.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.store.JsonColumns;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Single source of truth for whether a unit of work has been durably completed.
 *
 * <p>Sync jobs record their start, every checkpoint cursor and their terminal status
 * here; per-record and per-event idempotency keys are checked before any
 * external-effecting work and marked once that work is committed.</p>
 */
@ApplicationScoped
public class JobLedger {

    private static final Logger LOG = Logger.getLogger(JobLedger.class);

    static final String STARTED = "STARTED";

    private final SyncStore store;
    private final JsonColumns json;
    private final LedgerConfig config;

    @Inject
    public JobLedger(SyncStore store, ObjectMapper mapper, LedgerConfig config) {
        this.store = store;
        this.json = new JsonColumns(mapper);
        this.config = config;
    }

    public void recordStart(String id, LedgerKind kind) {
        String sql = """
            INSERT INTO ledger_entries (id, kind, status, started_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET status = excluded.status, completed_at = NULL
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                stmt.setString(2, kind.name());
                stmt.setString(3, STARTED);
                Rows.setInstant(stmt, 4, Instant.now());
                return stmt.executeUpdate();
            }
        });
    }

    public void recordCheckpoint(String id, String cursor) {
        String sql = "UPDATE ledger_entries SET cursor = ?, checkpoint_at = ? WHERE id = ?";
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, cursor);
                Rows.setInstant(stmt, 2, Instant.now());
                stmt.setString(3, id);
                return stmt.executeUpdate();
            }
        });
    }

    public void recordTerminal(String id, String status, Object stats) {
        String sql = "UPDATE ledger_entries SET status = ?, stats = ?, completed_at = ? WHERE id = ?";
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, status);
                stmt.setString(2, json.write(stats));
                Rows.setInstant(stmt, 3, Instant.now());
                stmt.setString(4, id);
                int updated = stmt.executeUpdate();
                if (updated == 0) {
                    LOG.warnf("Terminal status %s recorded for unknown ledger entry [%s]", status, id);
                }
                return updated;
            }
        });
    }

    public Optional<LedgerEntry> find(String id) {
        String sql = """
            SELECT id, kind, status, cursor, stats, started_at, checkpoint_at, completed_at
            FROM ledger_entries WHERE id = ?
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<LedgerEntry>empty();
                    }
                    return Optional.of(new LedgerEntry(
                        rs.getString("id"),
                        LedgerKind.valueOf(rs.getString("kind")),
                        rs.getString("status"),
                        rs.getString("cursor"),
                        rs.getString("stats"),
                        Rows.getInstant(rs, "started_at"),
                        Rows.getInstant(rs, "checkpoint_at"),
                        Rows.getInstant(rs, "completed_at")));
                }
            }
        });
    }

    public boolean isAlreadyProcessed(String idempotencyKey) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT 1 FROM idempotency_keys WHERE idempotency_key = ?")) {
                stmt.setString(1, idempotencyKey);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    /**
     * Mark a key as done. Marking an existing key again is a no-op.
     */
    public void markProcessed(String idempotencyKey, String unitId) {
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT OR IGNORE INTO idempotency_keys (idempotency_key, unit_id, processed_at) VALUES (?, ?, ?)")) {
                stmt.setString(1, idempotencyKey);
                stmt.setString(2, unitId);
                Rows.setInstant(stmt, 3, Instant.now());
                return stmt.executeUpdate();
            }
        });
    }

    /**
     * Compact terminal work older than the retention windows. Failed and partially failed
     * jobs and dead-lettered events are kept for the longer failure retention.
     */
    public RetentionResult compact(Instant now) {
        long cutoff = now.minus(config.retention()).toEpochMilli();
        long failureCutoff = now.minus(config.failureRetention()).toEpochMilli();

        RetentionResult result = store.inTransaction(conn -> new RetentionResult(
            delete(conn, """
                DELETE FROM ledger_entries
                WHERE completed_at IS NOT NULL
                  AND ((status IN ('FAILED', 'PARTIALLY_FAILED', 'DEAD_LETTERED') AND completed_at < ?)
                    OR (status NOT IN ('FAILED', 'PARTIALLY_FAILED', 'DEAD_LETTERED') AND completed_at < ?))
                """, failureCutoff, cutoff),
            delete(conn, "DELETE FROM idempotency_keys WHERE processed_at < ?", cutoff),
            delete(conn, """
                DELETE FROM sync_jobs
                WHERE completed_at IS NOT NULL
                  AND ((status IN ('FAILED', 'PARTIALLY_FAILED') AND completed_at < ?)
                    OR (status IN ('SUCCEEDED', 'CANCELLED') AND completed_at < ?))
                """, failureCutoff, cutoff),
            delete(conn, """
                DELETE FROM webhook_events
                WHERE (status = 'DEAD_LETTERED' AND updated_at < ?)
                   OR (status IN ('PROCESSED', 'DEDUPED') AND updated_at < ?)
                """, failureCutoff, cutoff)));

        if (result.total() > 0) {
            LOG.infof("Ledger compaction removed %d entries, %d idempotency keys, %d jobs, %d webhook events",
                result.ledgerEntries(), result.idempotencyKeys(), result.syncJobs(), result.webhookEvents());
        }
        return result;
    }

    private static int delete(Connection conn, String sql, long... params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setLong(i + 1, params[i]);
            }
            return stmt.executeUpdate();
        }
    }
}
