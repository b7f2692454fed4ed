package tech.syncbridge.platform.localstore;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.store.JsonColumns;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
public class SqliteLocalRecordRepository implements LocalRecordRepository {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = """
        instance_id, entity_type, external_id, data, change_seq, dirty,
        local_modified_at, remote_modified_at, synced_at
        """;

    private final SyncStore store;
    private final JsonColumns json;

    @Inject
    public SqliteLocalRecordRepository(SyncStore store, ObjectMapper mapper) {
        this.store = store;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public Optional<LocalRecord> find(String instanceId, String entityType, String externalId) {
        return store.withConnection(conn -> select(conn, instanceId, entityType, externalId));
    }

    @Override
    public LocalRecord saveLocalChange(String instanceId, String entityType, String externalId,
                                       Map<String, Object> data, Instant modifiedAt) {
        String sql = "INSERT INTO local_records (" + COLUMNS + """
            ) VALUES (?, ?, ?, ?, ?, 1, ?, NULL, NULL)
            ON CONFLICT(instance_id, entity_type, external_id) DO UPDATE SET
                data = excluded.data, change_seq = excluded.change_seq, dirty = 1,
                local_modified_at = excluded.local_modified_at
            """;
        return store.inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instanceId);
                stmt.setString(2, entityType);
                stmt.setString(3, externalId);
                stmt.setString(4, json.write(data));
                stmt.setLong(5, nextSeq(conn));
                Rows.setInstant(stmt, 6, modifiedAt);
                stmt.executeUpdate();
            }
            return select(conn, instanceId, entityType, externalId).orElseThrow();
        });
    }

    @Override
    public LocalRecord applyRemote(String instanceId, String entityType, String externalId,
                                   Map<String, Object> data, Instant remoteModifiedAt) {
        String sql = "INSERT INTO local_records (" + COLUMNS + """
            ) VALUES (?, ?, ?, ?, ?, 0, NULL, ?, ?)
            ON CONFLICT(instance_id, entity_type, external_id) DO UPDATE SET
                data = excluded.data, change_seq = excluded.change_seq, dirty = 0,
                remote_modified_at = excluded.remote_modified_at, synced_at = excluded.synced_at
            """;
        return store.inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instanceId);
                stmt.setString(2, entityType);
                stmt.setString(3, externalId);
                stmt.setString(4, json.write(data));
                stmt.setLong(5, nextSeq(conn));
                Rows.setInstant(stmt, 6, remoteModifiedAt);
                Rows.setInstant(stmt, 7, Instant.now());
                stmt.executeUpdate();
            }
            return select(conn, instanceId, entityType, externalId).orElseThrow();
        });
    }

    @Override
    public List<LocalRecord> findDirty(String instanceId, String entityType, long afterSeq, int limit) {
        String sql = "SELECT " + COLUMNS + """
             FROM local_records
            WHERE instance_id = ? AND entity_type = ? AND dirty = 1 AND change_seq > ?
            ORDER BY change_seq
            LIMIT ?
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instanceId);
                stmt.setString(2, entityType);
                stmt.setLong(3, afterSeq);
                stmt.setInt(4, limit);
                List<LocalRecord> result = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapRow(rs));
                    }
                }
                return result;
            }
        });
    }

    @Override
    public void markSynced(String instanceId, String entityType, String externalId, long pushedSeq,
                           Instant remoteModifiedAt) {
        String sql = """
            UPDATE local_records
            SET dirty = 0, remote_modified_at = ?, synced_at = ?
            WHERE instance_id = ? AND entity_type = ? AND external_id = ? AND change_seq = ?
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                Rows.setInstant(stmt, 1, remoteModifiedAt);
                Rows.setInstant(stmt, 2, Instant.now());
                stmt.setString(3, instanceId);
                stmt.setString(4, entityType);
                stmt.setString(5, externalId);
                stmt.setLong(6, pushedSeq);
                return stmt.executeUpdate();
            }
        });
    }

    private long nextSeq(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT COALESCE(MAX(change_seq), 0) + 1 FROM local_records");
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private Optional<LocalRecord> select(Connection conn, String instanceId, String entityType, String externalId)
            throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM local_records WHERE instance_id = ? AND entity_type = ? AND external_id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, instanceId);
            stmt.setString(2, entityType);
            stmt.setString(3, externalId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private LocalRecord mapRow(ResultSet rs) throws SQLException {
        LocalRecord record = new LocalRecord();
        record.instanceId = rs.getString("instance_id");
        record.entityType = rs.getString("entity_type");
        record.externalId = rs.getString("external_id");
        record.data = json.read(rs.getString("data"), MAP_TYPE);
        record.changeSeq = rs.getLong("change_seq");
        record.dirty = Rows.getBoolean(rs, "dirty");
        record.localModifiedAt = Rows.getInstant(rs, "local_modified_at");
        record.remoteModifiedAt = Rows.getInstant(rs, "remote_modified_at");
        record.syncedAt = Rows.getInstant(rs, "synced_at");
        return record;
    }
}
