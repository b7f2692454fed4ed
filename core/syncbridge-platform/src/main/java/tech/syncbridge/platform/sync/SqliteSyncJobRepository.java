package tech.syncbridge.platform.sync;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.store.JsonColumns;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
public class SqliteSyncJobRepository implements SyncJobRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Integer>> VERSION_MAP = new TypeReference<>() {};
    private static final TypeReference<List<RecordError>> ERROR_LIST = new TypeReference<>() {};

    private static final String COLUMNS = """
        id, instance_id, entity_types, direction, status, trigger_type, trigger_ref, target_external_ids,
        cursor, stats, mapping_versions, record_errors, failure, credential_ref, attempt, next_attempt_at,
        cancel_requested, created_at, started_at, completed_at, updated_at
        """;

    private static final String ACTIVE_STATUSES = "('QUEUED', 'RUNNING', 'THROTTLED')";

    private final SyncStore store;
    private final JsonColumns json;

    @Inject
    public SqliteSyncJobRepository(SyncStore store, ObjectMapper mapper) {
        this.store = store;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public boolean insert(SyncJob job) {
        String sql = "INSERT INTO sync_jobs (" + COLUMNS + """
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(trigger_ref) DO NOTHING
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, job.id);
                stmt.setString(2, job.instanceId);
                stmt.setString(3, json.write(new ArrayList<>(job.entityTypes)));
                stmt.setString(4, job.direction.name());
                stmt.setString(5, job.status.name());
                stmt.setString(6, job.trigger.name());
                stmt.setString(7, job.triggerRef);
                stmt.setString(8, json.write(job.targetExternalIds));
                bindProgress(stmt, job, 9);
                Rows.setInstant(stmt, 18, job.createdAt);
                Rows.setInstant(stmt, 19, job.startedAt);
                Rows.setInstant(stmt, 20, job.completedAt);
                Rows.setInstant(stmt, 21, job.updatedAt);
                return stmt.executeUpdate() == 1;
            }
        });
    }

    @Override
    public void update(SyncJob job) {
        String sql = """
            UPDATE sync_jobs
            SET cursor = ?, stats = ?, mapping_versions = ?, record_errors = ?, failure = ?, credential_ref = ?,
                attempt = ?, next_attempt_at = ?, cancel_requested = MAX(cancel_requested, ?), status = ?,
                started_at = ?, completed_at = ?, updated_at = ?
            WHERE id = ?
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                bindProgress(stmt, job, 1);
                stmt.setString(10, job.status.name());
                Rows.setInstant(stmt, 11, job.startedAt);
                Rows.setInstant(stmt, 12, job.completedAt);
                Rows.setInstant(stmt, 13, job.updatedAt);
                stmt.setString(14, job.id);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public Optional<SyncJob> findById(String id) {
        return query("SELECT " + COLUMNS + " FROM sync_jobs WHERE id = ?", id).stream().findFirst();
    }

    @Override
    public Optional<SyncJob> findByTriggerRef(String triggerRef) {
        return query("SELECT " + COLUMNS + " FROM sync_jobs WHERE trigger_ref = ?", triggerRef).stream().findFirst();
    }

    @Override
    public List<SyncJob> findByInstance(String instanceId, int limit) {
        return query("SELECT " + COLUMNS + " FROM sync_jobs WHERE instance_id = ? ORDER BY id DESC LIMIT " + limit,
            instanceId);
    }

    @Override
    public List<SyncJob> findActiveByInstance(String instanceId) {
        return query("SELECT " + COLUMNS + " FROM sync_jobs WHERE instance_id = ? AND status IN "
            + ACTIVE_STATUSES + " ORDER BY id", instanceId);
    }

    @Override
    public List<SyncJob> findActive(int limit) {
        return query("SELECT " + COLUMNS + " FROM sync_jobs WHERE status IN " + ACTIVE_STATUSES
            + " ORDER BY id LIMIT " + limit);
    }

    @Override
    public List<SyncJob> findByStatus(SyncJobStatus status) {
        return query("SELECT " + COLUMNS + " FROM sync_jobs WHERE status = ? ORDER BY id", status.name());
    }

    @Override
    public void requestCancel(String id) {
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE sync_jobs SET cancel_requested = 1 WHERE id = ?")) {
                stmt.setString(1, id);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public boolean isCancelRequested(String id) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT cancel_requested FROM sync_jobs WHERE id = ?")) {
                stmt.setString(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() && Rows.getBoolean(rs, "cancel_requested");
                }
            }
        });
    }

    @Override
    public Map<SyncJobStatus, Long> countByStatus(String instanceId) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT status, COUNT(*) AS cnt FROM sync_jobs WHERE instance_id = ? GROUP BY status")) {
                stmt.setString(1, instanceId);
                Map<SyncJobStatus, Long> counts = new EnumMap<>(SyncJobStatus.class);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        counts.put(SyncJobStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
                    }
                }
                return counts;
            }
        });
    }

    @Override
    public SyncStats sumStats(String instanceId) {
        String sql = """
            SELECT COALESCE(SUM(json_extract(stats, '$.recordsRead')), 0) AS records_read,
                   COALESCE(SUM(json_extract(stats, '$.recordsWritten')), 0) AS records_written,
                   COALESCE(SUM(json_extract(stats, '$.recordsFailed')), 0) AS records_failed,
                   COALESCE(SUM(json_extract(stats, '$.recordsDeduped')), 0) AS records_deduped,
                   COALESCE(SUM(json_extract(stats, '$.conflicts')), 0) AS conflicts
            FROM sync_jobs WHERE instance_id = ?
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instanceId);
                SyncStats totals = new SyncStats();
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        totals.recordsRead = rs.getLong("records_read");
                        totals.recordsWritten = rs.getLong("records_written");
                        totals.recordsFailed = rs.getLong("records_failed");
                        totals.recordsDeduped = rs.getLong("records_deduped");
                        totals.conflicts = rs.getLong("conflicts");
                    }
                }
                return totals;
            }
        });
    }

    /**
     * Binds cursor through cancel_requested (9 parameters).
     */
    private void bindProgress(PreparedStatement stmt, SyncJob job, int start) throws SQLException {
        int i = start;
        stmt.setString(i++, json.write(job.cursor));
        stmt.setString(i++, json.write(job.stats));
        stmt.setString(i++, json.write(job.mappingVersions));
        stmt.setString(i++, json.write(job.recordErrors));
        stmt.setString(i++, json.write(job.failure));
        stmt.setString(i++, job.credentialRef);
        stmt.setInt(i++, job.attempt);
        Rows.setInstant(stmt, i++, job.nextAttemptAt);
        stmt.setInt(i, job.cancelRequested ? 1 : 0);
    }

    private List<SyncJob> query(String sql, String... params) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setString(i + 1, params[i]);
                }
                List<SyncJob> result = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapRow(rs));
                    }
                }
                return result;
            }
        });
    }

    private SyncJob mapRow(ResultSet rs) throws SQLException {
        SyncJob job = new SyncJob();
        job.id = rs.getString("id");
        job.instanceId = rs.getString("instance_id");
        job.entityTypes = new LinkedHashSet<>(json.read(rs.getString("entity_types"), STRING_LIST));
        job.direction = SyncDirection.valueOf(rs.getString("direction"));
        job.status = SyncJobStatus.valueOf(rs.getString("status"));
        job.trigger = SyncTrigger.valueOf(rs.getString("trigger_type"));
        job.triggerRef = rs.getString("trigger_ref");
        job.targetExternalIds = json.read(rs.getString("target_external_ids"), STRING_LIST);
        JobCursor cursor = json.read(rs.getString("cursor"), JobCursor.class);
        job.cursor = cursor == null ? new JobCursor() : cursor;
        SyncStats stats = json.read(rs.getString("stats"), SyncStats.class);
        job.stats = stats == null ? new SyncStats() : stats;
        job.mappingVersions = json.read(rs.getString("mapping_versions"), VERSION_MAP);
        List<RecordError> errors = json.read(rs.getString("record_errors"), ERROR_LIST);
        job.recordErrors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
        job.failure = json.read(rs.getString("failure"), JobFailure.class);
        job.credentialRef = rs.getString("credential_ref");
        job.attempt = rs.getInt("attempt");
        job.nextAttemptAt = Rows.getInstant(rs, "next_attempt_at");
        job.cancelRequested = Rows.getBoolean(rs, "cancel_requested");
        job.createdAt = Rows.getInstant(rs, "created_at");
        job.startedAt = Rows.getInstant(rs, "started_at");
        job.completedAt = Rows.getInstant(rs, "completed_at");
        job.updatedAt = Rows.getInstant(rs, "updated_at");
        return job;
    }
}
