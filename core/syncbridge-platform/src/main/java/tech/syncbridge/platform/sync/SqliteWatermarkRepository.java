package tech.syncbridge.platform.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Optional;

@ApplicationScoped
public class SqliteWatermarkRepository implements WatermarkRepository {

    private final SyncStore store;

    @Inject
    public SqliteWatermarkRepository(SyncStore store) {
        this.store = store;
    }

    @Override
    public Optional<Watermark> find(String instanceId, String key) {
        String sql = """
            SELECT instance_id, watermark_key, cursor, version, updated_at
            FROM watermarks WHERE instance_id = ? AND watermark_key = ?
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instanceId);
                stmt.setString(2, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<Watermark>empty();
                    }
                    return Optional.of(new Watermark(
                        rs.getString("instance_id"),
                        rs.getString("watermark_key"),
                        rs.getString("cursor"),
                        rs.getLong("version"),
                        Rows.getInstant(rs, "updated_at")));
                }
            }
        });
    }

    @Override
    public long advance(String instanceId, String key, long expectedVersion, String cursor) {
        long newVersion = expectedVersion + 1;
        int updated = store.withConnection(conn -> {
            if (expectedVersion == 0) {
                try (PreparedStatement stmt = conn.prepareStatement("""
                        INSERT INTO watermarks (instance_id, watermark_key, cursor, version, updated_at)
                        VALUES (?, ?, ?, 1, ?)
                        ON CONFLICT(instance_id, watermark_key) DO NOTHING
                        """)) {
                    stmt.setString(1, instanceId);
                    stmt.setString(2, key);
                    stmt.setString(3, cursor);
                    Rows.setInstant(stmt, 4, Instant.now());
                    return stmt.executeUpdate();
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement("""
                    UPDATE watermarks SET cursor = ?, version = ?, updated_at = ?
                    WHERE instance_id = ? AND watermark_key = ? AND version = ?
                    """)) {
                stmt.setString(1, cursor);
                stmt.setLong(2, newVersion);
                Rows.setInstant(stmt, 3, Instant.now());
                stmt.setString(4, instanceId);
                stmt.setString(5, key);
                stmt.setLong(6, expectedVersion);
                return stmt.executeUpdate();
            }
        });
        if (updated != 1) {
            throw new WatermarkConflictException(instanceId, key, expectedVersion);
        }
        return newVersion;
    }
}
