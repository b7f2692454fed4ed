package tech.syncbridge.platform.mapping;

/**
 * INBOUND maps provider records into the local store (pull); OUTBOUND maps local
 * records to the provider schema (push).
 */
public enum MappingDirection {
    INBOUND,
    OUTBOUND
}
