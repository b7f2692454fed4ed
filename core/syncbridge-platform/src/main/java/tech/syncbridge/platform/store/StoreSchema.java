package tech.syncbridge.platform.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema of the sync store. Every statement is idempotent.
 */
public final class StoreSchema {

    private StoreSchema() {
        // Utility class
    }

    private static final String[] STATEMENTS = {
        """
        CREATE TABLE IF NOT EXISTS integration_instances (
            id TEXT PRIMARY KEY,
            tenant_id TEXT NOT NULL,
            name TEXT,
            provider_type TEXT NOT NULL,
            status TEXT NOT NULL,
            credential_ref TEXT,
            conflict_policy TEXT,
            schedule_entity_types TEXT,
            schedule_direction TEXT,
            schedule_interval_minutes INTEGER,
            last_scheduled_at INTEGER,
            total_syncs INTEGER NOT NULL DEFAULT 0,
            successful_syncs INTEGER NOT NULL DEFAULT 0,
            failed_syncs INTEGER NOT NULL DEFAULT 0,
            consecutive_auth_failures INTEGER NOT NULL DEFAULT 0,
            last_sync_at INTEGER,
            last_error TEXT,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_instances_tenant ON integration_instances(tenant_id)",
        """
        CREATE TABLE IF NOT EXISTS credentials (
            id TEXT PRIMARY KEY,
            instance_id TEXT NOT NULL,
            tenant_id TEXT NOT NULL,
            version INTEGER NOT NULL,
            ciphertext TEXT NOT NULL,
            status TEXT NOT NULL,
            expires_at INTEGER,
            created_at INTEGER NOT NULL,
            retired_at INTEGER,
            purge_after INTEGER,
            UNIQUE (instance_id, version)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS credential_audit (
            id TEXT PRIMARY KEY,
            instance_id TEXT NOT NULL,
            action TEXT NOT NULL,
            actor TEXT NOT NULL,
            credential_version INTEGER,
            outcome TEXT NOT NULL,
            occurred_at INTEGER NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_credential_audit_instance ON credential_audit(instance_id)",
        """
        CREATE TABLE IF NOT EXISTS field_mappings (
            id TEXT NOT NULL,
            version INTEGER NOT NULL,
            instance_id TEXT NOT NULL,
            entity_type TEXT NOT NULL,
            direction TEXT NOT NULL,
            definition TEXT NOT NULL,
            locked INTEGER NOT NULL DEFAULT 0,
            active INTEGER NOT NULL DEFAULT 1,
            created_at INTEGER NOT NULL,
            PRIMARY KEY (id, version)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_mappings_instance ON field_mappings(instance_id, entity_type, direction)",
        """
        CREATE TABLE IF NOT EXISTS sync_jobs (
            id TEXT PRIMARY KEY,
            instance_id TEXT NOT NULL,
            entity_types TEXT NOT NULL,
            direction TEXT NOT NULL,
            status TEXT NOT NULL,
            trigger_type TEXT NOT NULL,
            trigger_ref TEXT UNIQUE,
            target_external_ids TEXT,
            cursor TEXT,
            stats TEXT,
            mapping_versions TEXT,
            record_errors TEXT,
            failure TEXT,
            credential_ref TEXT,
            attempt INTEGER NOT NULL DEFAULT 0,
            next_attempt_at INTEGER,
            cancel_requested INTEGER NOT NULL DEFAULT 0,
            created_at INTEGER NOT NULL,
            started_at INTEGER,
            completed_at INTEGER,
            updated_at INTEGER NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_jobs_instance ON sync_jobs(instance_id, status)",
        """
        CREATE TABLE IF NOT EXISTS webhook_events (
            id TEXT PRIMARY KEY,
            instance_id TEXT NOT NULL,
            provider TEXT NOT NULL,
            event_type TEXT,
            entity_type TEXT,
            entity_refs TEXT,
            payload TEXT,
            payload_hash TEXT NOT NULL,
            signature_valid INTEGER NOT NULL,
            status TEXT NOT NULL,
            retry_count INTEGER NOT NULL DEFAULT 0,
            next_attempt_at INTEGER,
            last_error TEXT,
            received_at INTEGER NOT NULL,
            processed_at INTEGER,
            updated_at INTEGER NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_webhooks_dedupe ON webhook_events(instance_id, payload_hash, received_at)",
        "CREATE INDEX IF NOT EXISTS idx_webhooks_status ON webhook_events(status, next_attempt_at)",
        """
        CREATE TABLE IF NOT EXISTS conflict_records (
            id TEXT PRIMARY KEY,
            instance_id TEXT NOT NULL,
            job_id TEXT NOT NULL,
            entity_type TEXT NOT NULL,
            entity_id TEXT NOT NULL,
            source_version INTEGER,
            target_version INTEGER,
            source_data TEXT,
            target_data TEXT,
            policy TEXT NOT NULL,
            resolution TEXT NOT NULL,
            resolved_by TEXT,
            created_at INTEGER NOT NULL,
            resolved_at INTEGER
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_conflicts_entity ON conflict_records(instance_id, entity_type, entity_id)",
        """
        CREATE TABLE IF NOT EXISTS ledger_entries (
            id TEXT PRIMARY KEY,
            kind TEXT NOT NULL,
            status TEXT NOT NULL,
            cursor TEXT,
            stats TEXT,
            started_at INTEGER,
            checkpoint_at INTEGER,
            completed_at INTEGER
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS idempotency_keys (
            idempotency_key TEXT PRIMARY KEY,
            unit_id TEXT NOT NULL,
            processed_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS watermarks (
            instance_id TEXT NOT NULL,
            watermark_key TEXT NOT NULL,
            cursor TEXT,
            version INTEGER NOT NULL,
            updated_at INTEGER NOT NULL,
            PRIMARY KEY (instance_id, watermark_key)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS local_records (
            instance_id TEXT NOT NULL,
            entity_type TEXT NOT NULL,
            external_id TEXT NOT NULL,
            data TEXT NOT NULL,
            change_seq INTEGER NOT NULL,
            dirty INTEGER NOT NULL DEFAULT 0,
            local_modified_at INTEGER,
            remote_modified_at INTEGER,
            synced_at INTEGER,
            PRIMARY KEY (instance_id, entity_type, external_id)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_local_records_dirty ON local_records(instance_id, entity_type, dirty, change_seq)"
    };

    public static void initialize(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String sql : STATEMENTS) {
                stmt.execute(sql);
            }
        }
    }
}
