package tech.syncbridge.platform.webhook;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.store.JsonColumns;
import tech.syncbridge.platform.store.Rows;
import tech.syncbridge.platform.store.SyncStore;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@ApplicationScoped
public class SqliteWebhookEventRepository implements WebhookEventRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String COLUMNS = """
        id, instance_id, provider, event_type, entity_type, entity_refs, payload, payload_hash, signature_valid,
        status, retry_count, next_attempt_at, last_error, received_at, processed_at, updated_at
        """;

    private final SyncStore store;
    private final JsonColumns json;

    @Inject
    public SqliteWebhookEventRepository(SyncStore store, ObjectMapper mapper) {
        this.store = store;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public void insert(WebhookEvent event) {
        String sql = "INSERT INTO webhook_events (" + COLUMNS + """
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, event.id);
                stmt.setString(2, event.instanceId);
                stmt.setString(3, event.provider.name());
                stmt.setString(4, event.eventType);
                stmt.setString(5, event.entityType);
                stmt.setString(6, json.write(event.entityRefs));
                stmt.setString(7, event.payload);
                stmt.setString(8, event.payloadHash);
                stmt.setInt(9, event.signatureValid ? 1 : 0);
                stmt.setString(10, event.status.name());
                stmt.setInt(11, event.retryCount);
                Rows.setInstant(stmt, 12, event.nextAttemptAt);
                stmt.setString(13, event.lastError);
                Rows.setInstant(stmt, 14, event.receivedAt);
                Rows.setInstant(stmt, 15, event.processedAt);
                Rows.setInstant(stmt, 16, event.updatedAt);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void update(WebhookEvent event) {
        String sql = """
            UPDATE webhook_events
            SET status = ?, retry_count = ?, next_attempt_at = ?, last_error = ?, processed_at = ?, updated_at = ?
            WHERE id = ?
            """;
        store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, event.status.name());
                stmt.setInt(2, event.retryCount);
                Rows.setInstant(stmt, 3, event.nextAttemptAt);
                stmt.setString(4, event.lastError);
                Rows.setInstant(stmt, 5, event.processedAt);
                Rows.setInstant(stmt, 6, event.updatedAt);
                stmt.setString(7, event.id);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public Optional<WebhookEvent> findById(String id) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + COLUMNS + " FROM webhook_events WHERE id = ?")) {
                stmt.setString(1, id);
                return readAll(stmt).stream().findFirst();
            }
        });
    }

    @Override
    public Optional<WebhookEvent> findDuplicate(String instanceId, String payloadHash, Instant since,
                                                Collection<WebhookStatus> statuses) {
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT " + COLUMNS + """
            FROM webhook_events
            WHERE instance_id = ? AND payload_hash = ? AND received_at >= ? AND status IN (""" + placeholders + """
            )
            ORDER BY received_at, id LIMIT 1
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instanceId);
                stmt.setString(2, payloadHash);
                Rows.setInstant(stmt, 3, since);
                int i = 4;
                for (WebhookStatus status : statuses) {
                    stmt.setString(i++, status.name());
                }
                return readAll(stmt).stream().findFirst();
            }
        });
    }

    @Override
    public List<WebhookEvent> findDue(Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM webhook_events
            WHERE status = 'RECEIVED'
               OR (status = 'FAILED' AND (next_attempt_at IS NULL OR next_attempt_at <= ?))
            ORDER BY received_at, id LIMIT ?
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                Rows.setInstant(stmt, 1, now);
                stmt.setInt(2, limit);
                return readAll(stmt);
            }
        });
    }

    @Override
    public List<WebhookEvent> findByStatus(WebhookStatus status) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + COLUMNS + " FROM webhook_events WHERE status = ? ORDER BY received_at, id")) {
                stmt.setString(1, status.name());
                return readAll(stmt);
            }
        });
    }

    @Override
    public List<WebhookEvent> findByInstanceAndStatus(String instanceId, WebhookStatus status, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM webhook_events WHERE instance_id = ? AND status = ?
            ORDER BY received_at DESC, id DESC LIMIT ?
            """;
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, instanceId);
                stmt.setString(2, status.name());
                stmt.setInt(3, limit);
                return readAll(stmt);
            }
        });
    }

    @Override
    public Map<WebhookStatus, Long> countByStatus(String instanceId) {
        return store.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT status, COUNT(*) AS cnt FROM webhook_events WHERE instance_id = ? GROUP BY status")) {
                stmt.setString(1, instanceId);
                Map<WebhookStatus, Long> counts = new EnumMap<>(WebhookStatus.class);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        counts.put(WebhookStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
                    }
                }
                return counts;
            }
        });
    }

    private List<WebhookEvent> readAll(PreparedStatement stmt) throws SQLException {
        List<WebhookEvent> result = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                result.add(mapRow(rs));
            }
        }
        return result;
    }

    private WebhookEvent mapRow(ResultSet rs) throws SQLException {
        WebhookEvent event = new WebhookEvent();
        event.id = rs.getString("id");
        event.instanceId = rs.getString("instance_id");
        event.provider = ProviderType.valueOf(rs.getString("provider"));
        event.eventType = rs.getString("event_type");
        event.entityType = rs.getString("entity_type");
        List<String> refs = json.read(rs.getString("entity_refs"), STRING_LIST);
        event.entityRefs = refs == null ? List.of() : refs;
        event.payload = rs.getString("payload");
        event.payloadHash = rs.getString("payload_hash");
        event.signatureValid = Rows.getBoolean(rs, "signature_valid");
        event.status = WebhookStatus.valueOf(rs.getString("status"));
        event.retryCount = rs.getInt("retry_count");
        event.nextAttemptAt = Rows.getInstant(rs, "next_attempt_at");
        event.lastError = rs.getString("last_error");
        event.receivedAt = Rows.getInstant(rs, "received_at");
        event.processedAt = Rows.getInstant(rs, "processed_at");
        event.updatedAt = Rows.getInstant(rs, "updated_at");
        return event;
    }
}
