package tech.syncbridge.platform.provider;

/**
 * An entry of a change page that could not be read as a record.
 *
 * @param externalId the provider id when the entry carried one, otherwise {@code null}
 */
public record MalformedRecord(String externalId, String reason) {
}
