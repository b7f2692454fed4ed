package tech.syncbridge.platform.credential;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

@ApplicationScoped
public class SqliteCredentialRepository implements CredentialRepository {

    private static final String COLUMNS =
        "id, instance_id, tenant_id, version, ciphertext, status, expires_at, created_at, retired_at, purge_after";

    private final SyncStore store;

    @Inject
    public SqliteCredentialRepository(SyncStore store) {
        this.store = store;
    }

    @Override
    public void insert(StoredCredential credential) {
        String sql = "INSERT INTO credentials (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, credential.id);
                stmt.setString(2, credential.instanceId);
                stmt.setString(3, credential.tenantId);
                stmt.setInt(4, credential.version);
                stmt.setString(5, credential.ciphertext);
                stmt.setString(6, credential.status.name());
                Rows.setInstant(stmt, 7, credential.expiresAt);
                Rows.setInstant(stmt, 8, credential.createdAt);
                Rows.setInstant(stmt, 9, credential.retiredAt);
                Rows.setInstant(stmt, 10, credential.purgeAfter);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public Optional<StoredCredential> findActive(String instanceId) {
        return findOne("SELECT " + COLUMNS + " FROM credentials WHERE instance_id = ? AND status = 'ACTIVE'", instanceId);
    }

    @Override
    public Optional<StoredCredential> findById(String id) {
        return findOne("SELECT " + COLUMNS + " FROM credentials WHERE id = ?", id);
    }

    @Override
    public int nextVersion(String instanceId) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT COALESCE(MAX(version), 0) + 1 FROM credentials WHERE instance_id = ?")) {
                stmt.setString(1, instanceId);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    return rs.getInt(1);
                }
            }
        });
    }

    @Override
    public void retireActive(String instanceId, Instant retiredAt, Instant purgeAfter) {
        String sql = """
            UPDATE credentials
            SET status = 'RETIRED', retired_at = ?, purge_after = ?
            WHERE instance_id = ? AND status = 'ACTIVE'
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                Rows.setInstant(stmt, 1, retiredAt);
                Rows.setInstant(stmt, 2, purgeAfter);
                stmt.setString(3, instanceId);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public int deleteByInstance(String instanceId) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM credentials WHERE instance_id = ?")) {
                stmt.setString(1, instanceId);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public int deleteRetiredBefore(Instant cutoff) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM credentials WHERE status = 'RETIRED' AND purge_after <= ?")) {
                Rows.setInstant(stmt, 1, cutoff);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void insertAudit(CredentialAuditEntry entry) {
        String sql = """
            INSERT INTO credential_audit (id, instance_id, action, actor, credential_version, outcome, occurred_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, entry.id());
                stmt.setString(2, entry.instanceId());
                stmt.setString(3, entry.action());
                stmt.setString(4, entry.actor());
                Rows.setNullableInt(stmt, 5, entry.credentialVersion());
                stmt.setString(6, entry.outcome());
                Rows.setInstant(stmt, 7, entry.occurredAt());
                return stmt.executeUpdate();
            }
        });
    }

    private Optional<StoredCredential> findOne(String sql, String param) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, param);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.<StoredCredential>empty();
                }
            }
        });
    }

    private StoredCredential mapRow(ResultSet rs) throws SQLException {
        StoredCredential credential = new StoredCredential();
        credential.id = rs.getString("id");
        credential.instanceId = rs.getString("instance_id");
        credential.tenantId = rs.getString("tenant_id");
        credential.version = rs.getInt("version");
        credential.ciphertext = rs.getString("ciphertext");
        credential.status = StoredCredential.Status.valueOf(rs.getString("status"));
        credential.expiresAt = Rows.getInstant(rs, "expires_at");
        credential.createdAt = Rows.getInstant(rs, "created_at");
        credential.retiredAt = Rows.getInstant(rs, "retired_at");
        credential.purgeAfter = Rows.getInstant(rs, "purge_after");
        return credential;
    }
}
