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
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
public class SqliteConflictRepository implements ConflictRepository {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = """
        id, instance_id, job_id, entity_type, entity_id, source_version, target_version,
        source_data, target_data, policy, resolution, resolved_by, created_at, resolved_at
        """;

    private static final String OPEN = "resolution = 'MANUAL_REQUIRED' AND resolved_at IS NULL";

    private final SyncStore store;
    private final JsonColumns json;

    @Inject
    public SqliteConflictRepository(SyncStore store, ObjectMapper mapper) {
        this.store = store;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public void insert(ConflictRecord conflict) {
        String sql = "INSERT INTO conflict_records (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, conflict.id);
                stmt.setString(2, conflict.instanceId);
                stmt.setString(3, conflict.jobId);
                stmt.setString(4, conflict.entityType);
                stmt.setString(5, conflict.entityId);
                Rows.setInstant(stmt, 6, conflict.sourceVersion);
                Rows.setInstant(stmt, 7, conflict.targetVersion);
                stmt.setString(8, json.write(conflict.sourceData));
                stmt.setString(9, json.write(conflict.targetData));
                stmt.setString(10, conflict.policy.name());
                stmt.setString(11, conflict.resolution.name());
                stmt.setString(12, conflict.resolvedBy);
                Rows.setInstant(stmt, 13, conflict.createdAt);
                Rows.setInstant(stmt, 14, conflict.resolvedAt);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void update(ConflictRecord conflict) {
        String sql = "UPDATE conflict_records SET resolution = ?, resolved_by = ?, resolved_at = ? WHERE id = ?";
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, conflict.resolution.name());
                stmt.setString(2, conflict.resolvedBy);
                Rows.setInstant(stmt, 3, conflict.resolvedAt);
                stmt.setString(4, conflict.id);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public Optional<ConflictRecord> findById(String id) {
        return query("SELECT " + COLUMNS + " FROM conflict_records WHERE id = ?", id).stream().findFirst();
    }

    @Override
    public List<ConflictRecord> findByInstance(String instanceId, boolean openOnly) {
        String sql = "SELECT " + COLUMNS + " FROM conflict_records WHERE instance_id = ?"
            + (openOnly ? " AND " + OPEN : "") + " ORDER BY id";
        return query(sql, instanceId);
    }

    @Override
    public boolean hasOpenConflict(String instanceId, String entityType, String entityId) {
        return !query("SELECT " + COLUMNS + " FROM conflict_records WHERE instance_id = ? AND entity_type = ? AND entity_id = ? AND "
            + OPEN + " LIMIT 1", instanceId, entityType, entityId).isEmpty();
    }

    private List<ConflictRecord> query(String sql, String... params) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setString(i + 1, params[i]);
                }
                List<ConflictRecord> result = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapRow(rs));
                    }
                }
                return result;
            }
        });
    }

    private ConflictRecord mapRow(ResultSet rs) throws SQLException {
        ConflictRecord conflict = new ConflictRecord();
        conflict.id = rs.getString("id");
        conflict.instanceId = rs.getString("instance_id");
        conflict.jobId = rs.getString("job_id");
        conflict.entityType = rs.getString("entity_type");
        conflict.entityId = rs.getString("entity_id");
        conflict.sourceVersion = Rows.getInstant(rs, "source_version");
        conflict.targetVersion = Rows.getInstant(rs, "target_version");
        conflict.sourceData = json.read(rs.getString("source_data"), MAP_TYPE);
        conflict.targetData = json.read(rs.getString("target_data"), MAP_TYPE);
        conflict.policy = ConflictPolicy.valueOf(rs.getString("policy"));
        conflict.resolution = ConflictResolution.valueOf(rs.getString("resolution"));
        conflict.resolvedBy = rs.getString("resolved_by");
        conflict.createdAt = Rows.getInstant(rs, "created_at");
        conflict.resolvedAt = Rows.getInstant(rs, "resolved_at");
        return conflict;
    }
}
