package tech.syncbridge.platform.provider;

import java.time.Instant;

public record WriteResult(String externalId, Instant modifiedAt) {
}
