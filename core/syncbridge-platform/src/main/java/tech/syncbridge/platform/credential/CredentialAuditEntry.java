package tech.syncbridge.platform.credential;

import java.time.Instant;

/**
 * Audit row for a credential operation. Never carries secret material.
 */
public record CredentialAuditEntry(
    String id,
    String instanceId,
    String action,
    String actor,
    Integer credentialVersion,
    String outcome,
    Instant occurredAt
) {
}
