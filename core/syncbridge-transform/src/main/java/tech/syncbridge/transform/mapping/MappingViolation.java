package tech.syncbridge.transform.mapping;

/**
 * One problem found while validating a mapping.
 *
 * @param location rule position and field, e.g. {@code rules[2].targetField}
 * @param code     machine readable code
 * @param message  human readable explanation
 */
public record MappingViolation(String location, String code, String message) {

    public static final String DUPLICATE_TARGET_FIELD = "DUPLICATE_TARGET_FIELD";
    public static final String UNKNOWN_FUNCTION = "UNKNOWN_FUNCTION";
    public static final String INVALID_PATH = "INVALID_PATH";
    public static final String MISSING_SOURCE_FIELD = "MISSING_SOURCE_FIELD";
    public static final String INVALID_CONFIG = "INVALID_CONFIG";
    public static final String INVALID_PATTERN = "INVALID_PATTERN";
    public static final String DEPENDENCY_NOT_SATISFIED = "DEPENDENCY_NOT_SATISFIED";
    public static final String UNSATISFIABLE_REQUIRED_FIELD = "UNSATISFIABLE_REQUIRED_FIELD";
    public static final String EMPTY_MAPPING = "EMPTY_MAPPING";
}
