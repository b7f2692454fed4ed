package tech.syncbridge.platform.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.store.JsonColumns;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;
import tech.syncbridge.transform.mapping.FieldMapping;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class SqliteFieldMappingRepository implements FieldMappingRepository {

    private static final String COLUMNS =
        "id, version, instance_id, entity_type, direction, definition, locked, active, created_at";

    private static final String LATEST_ACTIVE = """
        SELECT m.id, m.version, m.instance_id, m.entity_type, m.direction, m.definition, m.locked, m.active, m.created_at
        FROM field_mappings m
        WHERE m.active = 1
          AND m.version = (SELECT MAX(v.version) FROM field_mappings v WHERE v.id = m.id)
        """;

    private final SyncStore store;
    private final JsonColumns json;

    @Inject
    public SqliteFieldMappingRepository(SyncStore store, ObjectMapper mapper) {
        this.store = store;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public void insert(FieldMappingVersion version) {
        String sql = "INSERT INTO field_mappings (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, version.id);
                stmt.setInt(2, version.version);
                stmt.setString(3, version.instanceId);
                stmt.setString(4, version.entityType);
                stmt.setString(5, version.direction.name());
                stmt.setString(6, json.write(version.mapping));
                stmt.setInt(7, version.locked ? 1 : 0);
                stmt.setInt(8, version.active ? 1 : 0);
                Rows.setInstant(stmt, 9, version.createdAt);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void updateDefinition(String id, int version, FieldMapping mapping) {
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE field_mappings SET definition = ? WHERE id = ? AND version = ? AND locked = 0")) {
                stmt.setString(1, json.write(mapping));
                stmt.setString(2, id);
                stmt.setInt(3, version);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public Optional<FieldMappingVersion> findLatest(String id) {
        List<FieldMappingVersion> versions = query(
            "SELECT " + COLUMNS + " FROM field_mappings WHERE id = ? ORDER BY version DESC LIMIT 1", id);
        return versions.stream().findFirst();
    }

    @Override
    public Optional<FieldMappingVersion> findVersion(String id, int version) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + COLUMNS + " FROM field_mappings WHERE id = ? AND version = ?")) {
                stmt.setString(1, id);
                stmt.setInt(2, version);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.<FieldMappingVersion>empty();
                }
            }
        });
    }

    @Override
    public List<FieldMappingVersion> findVersions(String id) {
        return query("SELECT " + COLUMNS + " FROM field_mappings WHERE id = ? ORDER BY version", id);
    }

    @Override
    public Optional<FieldMappingVersion> findActive(String instanceId, String entityType, MappingDirection direction) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    LATEST_ACTIVE + " AND m.instance_id = ? AND m.entity_type = ? AND m.direction = ?")) {
                stmt.setString(1, instanceId);
                stmt.setString(2, entityType);
                stmt.setString(3, direction.name());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.<FieldMappingVersion>empty();
                }
            }
        });
    }

    @Override
    public List<FieldMappingVersion> findByInstance(String instanceId) {
        return query(LATEST_ACTIVE + " AND m.instance_id = ? ORDER BY m.entity_type, m.direction", instanceId);
    }

    @Override
    public void deactivate(String id) {
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("UPDATE field_mappings SET active = 0 WHERE id = ?")) {
                stmt.setString(1, id);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void lock(String id, int version) {
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE field_mappings SET locked = 1 WHERE id = ? AND version = ?")) {
                stmt.setString(1, id);
                stmt.setInt(2, version);
                return stmt.executeUpdate();
            }
        });
    }

    private List<FieldMappingVersion> query(String sql, String param) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, param);
                List<FieldMappingVersion> result = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapRow(rs));
                    }
                }
                return result;
            }
        });
    }

    private FieldMappingVersion mapRow(ResultSet rs) throws SQLException {
        FieldMappingVersion version = new FieldMappingVersion();
        version.id = rs.getString("id");
        version.version = rs.getInt("version");
        version.instanceId = rs.getString("instance_id");
        version.entityType = rs.getString("entity_type");
        version.direction = MappingDirection.valueOf(rs.getString("direction"));
        version.mapping = json.read(rs.getString("definition"), FieldMapping.class);
        version.locked = Rows.getBoolean(rs, "locked");
        version.active = Rows.getBoolean(rs, "active");
        version.createdAt = Rows.getInstant(rs, "created_at");
        return version;
    }
}
