package tech.syncbridge.platform.integration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.store.JsonColumns;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;
import tech.syncbridge.platform.sync.ConflictPolicy;
import tech.syncbridge.platform.sync.SyncDirection;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class SqliteIntegrationInstanceRepository implements IntegrationInstanceRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String COLUMNS = """
        id, tenant_id, name, provider_type, status, credential_ref, conflict_policy,
        schedule_entity_types, schedule_direction, schedule_interval_minutes, last_scheduled_at,
        total_syncs, successful_syncs, failed_syncs, consecutive_auth_failures,
        last_sync_at, last_error, created_at, updated_at
        """;

    private final SyncStore store;
    private final JsonColumns json;

    @Inject
    public SqliteIntegrationInstanceRepository(SyncStore store, ObjectMapper mapper) {
        this.store = store;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public void insert(IntegrationInstance instance) {
        String sql = "INSERT INTO integration_instances (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instance.id);
                bindMutable(stmt, instance, 2);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void update(IntegrationInstance instance) {
        String sql = """
            UPDATE integration_instances
            SET tenant_id = ?, name = ?, provider_type = ?, status = ?, credential_ref = ?, conflict_policy = ?,
                schedule_entity_types = ?, schedule_direction = ?, schedule_interval_minutes = ?, last_scheduled_at = ?,
                total_syncs = ?, successful_syncs = ?, failed_syncs = ?, consecutive_auth_failures = ?,
                last_sync_at = ?, last_error = ?, created_at = ?, updated_at = ?
            WHERE id = ?
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int next = bindMutable(stmt, instance, 1);
                stmt.setString(next, instance.id);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public Optional<IntegrationInstance> findById(String id) {
        List<IntegrationInstance> found = query("SELECT " + COLUMNS + " FROM integration_instances WHERE id = ?", id);
        return found.stream().findFirst();
    }

    @Override
    public List<IntegrationInstance> findByTenant(String tenantId) {
        return query("SELECT " + COLUMNS + " FROM integration_instances WHERE tenant_id = ? ORDER BY id", tenantId);
    }

    @Override
    public List<IntegrationInstance> findScheduled() {
        return query("SELECT " + COLUMNS + """
             FROM integration_instances
            WHERE status = ? AND schedule_interval_minutes IS NOT NULL
            ORDER BY id
            """, IntegrationStatus.ACTIVE.name());
    }

    private List<IntegrationInstance> query(String sql, String param) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, param);
                List<IntegrationInstance> result = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapRow(rs));
                    }
                }
                return result;
            }
        });
    }

    private int bindMutable(PreparedStatement stmt, IntegrationInstance instance, int start) throws SQLException {
        int i = start;
        stmt.setString(i++, instance.tenantId);
        stmt.setString(i++, instance.name);
        stmt.setString(i++, instance.providerType.name());
        stmt.setString(i++, instance.status.name());
        stmt.setString(i++, instance.credentialRef);
        stmt.setString(i++, instance.conflictPolicy == null ? null : instance.conflictPolicy.name());
        SyncSchedule schedule = instance.schedule;
        stmt.setString(i++, schedule == null ? null : json.write(schedule.entityTypes()));
        stmt.setString(i++, schedule == null ? null : schedule.direction().name());
        Rows.setNullableInt(stmt, i++, schedule == null ? null : schedule.intervalMinutes());
        Rows.setInstant(stmt, i++, instance.lastScheduledAt);
        stmt.setInt(i++, instance.totalSyncs);
        stmt.setInt(i++, instance.successfulSyncs);
        stmt.setInt(i++, instance.failedSyncs);
        stmt.setInt(i++, instance.consecutiveAuthFailures);
        Rows.setInstant(stmt, i++, instance.lastSyncAt);
        stmt.setString(i++, instance.lastError);
        Rows.setInstant(stmt, i++, instance.createdAt);
        Rows.setInstant(stmt, i++, instance.updatedAt);
        return i;
    }

    private IntegrationInstance mapRow(ResultSet rs) throws SQLException {
        IntegrationInstance instance = new IntegrationInstance();
        instance.id = rs.getString("id");
        instance.tenantId = rs.getString("tenant_id");
        instance.name = rs.getString("name");
        instance.providerType = ProviderType.valueOf(rs.getString("provider_type"));
        instance.status = IntegrationStatus.valueOf(rs.getString("status"));
        instance.credentialRef = rs.getString("credential_ref");
        String policy = rs.getString("conflict_policy");
        instance.conflictPolicy = policy == null ? null : ConflictPolicy.valueOf(policy);
        Integer interval = Rows.getNullableInt(rs, "schedule_interval_minutes");
        if (interval != null) {
            instance.schedule = new SyncSchedule(
                json.read(rs.getString("schedule_entity_types"), STRING_LIST),
                SyncDirection.valueOf(rs.getString("schedule_direction")),
                interval);
        }
        instance.lastScheduledAt = Rows.getInstant(rs, "last_scheduled_at");
        instance.totalSyncs = rs.getInt("total_syncs");
        instance.successfulSyncs = rs.getInt("successful_syncs");
        instance.failedSyncs = rs.getInt("failed_syncs");
        instance.consecutiveAuthFailures = rs.getInt("consecutive_auth_failures");
        instance.lastSyncAt = Rows.getInstant(rs, "last_sync_at");
        instance.lastError = rs.getString("last_error");
        instance.createdAt = Rows.getInstant(rs, "created_at");
        instance.updatedAt = Rows.getInstant(rs, "updated_at");
        return instance;
    }
}
